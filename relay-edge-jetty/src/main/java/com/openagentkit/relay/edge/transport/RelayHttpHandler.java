/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.openagentkit.relay.edge.EdgeRoute;
import com.openagentkit.relay.edge.RelayHttpResponse;
import com.openagentkit.relay.edge.RelayRequestFacade;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpHeaderValue;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpVersion;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.io.EndPoint;
import org.eclipse.jetty.io.EofException;
import org.eclipse.jetty.server.ConnectionMetaData;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.Callback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

/**
 * Serves the agent-facing HTTP endpoints by delegating to a {@link RelayRequestFacade}.
 * Requests for unknown paths fall through to Jetty's 404.
 *
 * @author Oak Relay Contributors
 */
class RelayHttpHandler extends Handler.Abstract {

	private static final Logger logger = LoggerFactory.getLogger(RelayHttpHandler.class);

	private static final String JSON_CONTENT_TYPE = "application/json";

	private static final int DISCONNECT_PROBE_BYTES = 512;

	private final RelayRequestFacade facade;

	private final String defaultProject;

	RelayHttpHandler(RelayRequestFacade facade, String defaultProject) {
		this.facade = facade;
		this.defaultProject = defaultProject;
	}

	@Override
	public boolean handle(Request request, Response response, Callback callback) throws Exception {
		Optional<EdgeRoute> resolved = EdgeRoute.parse(Request.getPathInContext(request), this.defaultProject);
		if (resolved.isEmpty() || resolved.get().endpoint() == EdgeRoute.Endpoint.WS) {
			return false;
		}
		EdgeRoute route = resolved.get();
		String method = request.getMethod();
		addCorsHeaders(response);

		if (HttpMethod.OPTIONS.is(method)) {
			response.setStatus(204);
			callback.succeeded();
			return true;
		}

		String authorization = request.getHeaders().get(HttpHeader.AUTHORIZATION);
		switch (route.endpoint()) {
			case HEALTH -> {
				if (!HttpMethod.GET.is(method)) {
					return methodNotAllowed(response, callback);
				}
				write(response, callback, this.facade.handleHealth(route.project()));
			}
			case TOOLS -> {
				if (!HttpMethod.GET.is(method)) {
					return methodNotAllowed(response, callback);
				}
				write(response, callback, this.facade.handleTools(route.project(), authorization));
			}
			case RELAY -> {
				if (!HttpMethod.POST.is(method)) {
					return methodNotAllowed(response, callback);
				}
				String body = Content.Source.asString(request, StandardCharsets.UTF_8);
				relay(request, response, callback, this.facade.handleRelay(route.project(), authorization, body));
			}
			case MCP -> {
				if (!HttpMethod.POST.is(method)) {
					return methodNotAllowed(response, callback);
				}
				String body = Content.Source.asString(request, StandardCharsets.UTF_8);
				relay(request, response, callback, this.facade.handleMcp(route.project(), authorization, body));
			}
			default -> {
				return false;
			}
		}
		return true;
	}

	/**
	 * Writes the answer of a relayed call once it arrives. If the client goes away first,
	 * the wait is cancelled so the pending request is retired early.
	 */
	private static void relay(Request request, Response response, Callback callback, Mono<RelayHttpResponse> answer) {
		Disposable.Swap call = Disposables.swap();
		request.addFailureListener(failure -> call.dispose());
		// a connection with a read pending cannot be reused after the response
		response.getHeaders().put(HttpHeader.CONNECTION, HttpHeaderValue.CLOSE.asString());
		watchForDisconnect(request, response, callback, call);
		call.update(answer.subscribe(result -> write(response, callback, result), error -> {
			logger.error("Relay request failed", error);
			callback.failed(error);
		}));
	}

	/**
	 * Jetty does not read an HTTP/1 connection again until the response is complete, so a
	 * client closing its socket after sending the body goes unnoticed. Registering read
	 * interest on the endpoint surfaces that close as an EOF.
	 */
	private static void watchForDisconnect(Request request, Response response, Callback callback, Disposable call) {
		ConnectionMetaData metaData = request.getConnectionMetaData();
		if (metaData.getHttpVersion().getVersion() > HttpVersion.HTTP_1_1.getVersion()) {
			return;
		}
		EndPoint endPoint = metaData.getConnection().getEndPoint();
		endPoint.tryFillInterested(new Callback() {
			@Override
			public void succeeded() {
				if (call.isDisposed() || response.isCommitted()) {
					return;
				}
				int filled;
				try {
					filled = endPoint.fill(BufferUtil.allocate(DISCONNECT_PROBE_BYTES));
				}
				catch (IOException e) {
					logger.debug("Read from {} failed while awaiting relay answer: {}", endPoint.getRemoteSocketAddress(),
							e.getMessage());
					filled = -1;
				}
				if (filled < 0) {
					logger.debug("Client {} disconnected before the relay answered", endPoint.getRemoteSocketAddress());
					abandon(new EofException("Client disconnected"));
				}
				else if (filled == 0) {
					endPoint.tryFillInterested(this);
				}
				else {
					logger.warn("Discarded {} bytes sent by {} before the relay answered", filled,
							endPoint.getRemoteSocketAddress());
				}
			}

			@Override
			public void failed(Throwable x) {
				if (!call.isDisposed() && !response.isCommitted()) {
					abandon(x);
				}
			}

			private void abandon(Throwable cause) {
				call.dispose();
				callback.failed(cause);
			}
		});
	}

	private static boolean methodNotAllowed(Response response, Callback callback) {
		response.setStatus(405);
		callback.succeeded();
		return true;
	}

	private static void write(Response response, Callback callback, RelayHttpResponse result) {
		response.setStatus(result.status());
		response.getHeaders().put(HttpHeader.CONTENT_TYPE, JSON_CONTENT_TYPE);
		Content.Sink.write(response, true, result.body(), callback);
	}

	private static void addCorsHeaders(Response response) {
		response.getHeaders().put("Access-Control-Allow-Origin", "*");
		response.getHeaders().put("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
		response.getHeaders().put("Access-Control-Allow-Headers", "Authorization, Content-Type");
	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge.transport;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import com.openagentkit.relay.edge.EdgeSession;
import com.openagentkit.relay.edge.RelaySessionChannel;
import com.openagentkit.relay.edge.SessionCoordinator;
import com.openagentkit.relay.error.RelayErrorKinds;
import com.openagentkit.relay.error.RelayException;
import com.openagentkit.relay.spec.RelaySchema;
import com.openagentkit.relay.spec.RelaySchema.CallFrame;
import com.openagentkit.relay.spec.RelaySchema.ErrorFrame;
import com.openagentkit.relay.spec.RelaySchema.HeartbeatFrame;
import com.openagentkit.relay.spec.RelaySchema.RegisterFrame;
import com.openagentkit.relay.spec.RelaySchema.RegisteredFrame;
import com.openagentkit.relay.spec.RelaySchema.RelayFrame;
import com.openagentkit.relay.spec.RelaySchema.ResponseFrame;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.eclipse.jetty.websocket.api.Callback;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketOpen;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One daemon connection, already authenticated during the upgrade. The first frame
 * must be {@code register}; after that the endpoint feeds heartbeats and answers to the
 * {@link SessionCoordinator} and writes calls handed to it as a
 * {@link RelaySessionChannel}.
 *
 * @author Oak Relay Contributors
 */
@WebSocket
public class RelayWebSocketEndpoint implements RelaySessionChannel {

	private static final Logger logger = LoggerFactory.getLogger(RelayWebSocketEndpoint.class);

	private final String project;

	private final String relayToken;

	private final SessionCoordinator coordinator;

	private final McpJsonMapper jsonMapper;

	private final Sinks.Many<Outbound> outboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private volatile Session socket;

	private volatile EdgeSession session;

	RelayWebSocketEndpoint(String project, String relayToken, SessionCoordinator coordinator,
			McpJsonMapper jsonMapper) {
		this.project = project;
		this.relayToken = relayToken;
		this.coordinator = coordinator;
		this.jsonMapper = jsonMapper;
	}

	@OnWebSocketOpen
	public void onOpen(Session socket) {
		logger.info("Project {}: daemon connected from {}", this.project, socket.getRemoteSocketAddress());
		this.socket = socket;
		this.outboundSink.asFlux()
			.concatMap(outbound -> write(outbound.frame()).doOnSuccess(v -> outbound.done().tryEmitEmpty())
				.onErrorResume(error -> {
					outbound.done().tryEmitError(error);
					return Mono.empty();
				}))
			.subscribe();
	}

	@OnWebSocketMessage
	public void onMessage(Session socket, String message) {
		RelayFrame frame;
		try {
			frame = RelaySchema.deserializeFrame(this.jsonMapper, message);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.warn("Project {}: invalid frame from daemon: {}", this.project, e.getMessage());
			reply(new ErrorFrame(null, RelayErrorKinds.PROTOCOL_ERROR, "Invalid frame: " + e.getMessage()));
			return;
		}

		EdgeSession current = this.session;
		if (current == null) {
			onUnregisteredFrame(frame);
			return;
		}
		long generation = current.generation();

		if (frame instanceof ResponseFrame || frame instanceof ErrorFrame && ((ErrorFrame) frame).id() != null) {
			this.coordinator.completeResponse(this.project, generation, frame);
		}
		else if (frame instanceof HeartbeatFrame) {
			if (this.coordinator.heartbeat(this.project, generation)) {
				reply(new HeartbeatFrame(Instant.now().toString()));
			}
		}
		else if (frame instanceof RegisterFrame register) {
			if (this.coordinator.updateTools(this.project, generation, register.tools())) {
				reply(new RegisteredFrame(generation));
			}
		}
		else if (frame instanceof ErrorFrame error) {
			this.coordinator.heartbeat(this.project, generation);
			logger.warn("Project {}: daemon reported [{}] {}", this.project, error.kind(), error.message());
		}
		else if (frame instanceof CallFrame call) {
			reply(new ErrorFrame(call.id(), RelayErrorKinds.PROTOCOL_ERROR, "The relay does not accept calls"));
		}
		else {
			logger.warn("Project {}: unexpected {} frame from daemon", this.project, frame.getClass().getSimpleName());
			reply(new ErrorFrame(null, RelayErrorKinds.PROTOCOL_ERROR, "Unexpected frame"));
		}
	}

	private void onUnregisteredFrame(RelayFrame frame) {
		if (frame instanceof HeartbeatFrame) {
			return;
		}
		if (!(frame instanceof RegisterFrame register)) {
			logger.warn("Project {}: {} frame before register", this.project, frame.getClass().getSimpleName());
			reply(new ErrorFrame(null, RelayErrorKinds.PROTOCOL_ERROR, "Expected register frame"));
			return;
		}
		try {
			EdgeSession registered = this.coordinator.register(this.project, this.relayToken, this,
					register.tools());
			this.session = registered;
			reply(new RegisteredFrame(registered.generation()));
		}
		catch (RelayException e) {
			logger.warn("Project {}: registration refused: {}", this.project, e.getMessage());
			reply(e.toErrorFrame(null));
			close(CLOSE_PROTOCOL_ERROR, e.getKind());
		}
	}

	@OnWebSocketClose
	public void onClose(Session socket, int statusCode, String reason) {
		logger.info("Project {}: daemon disconnected: {} - {}", this.project, statusCode, reason);
		terminate();
	}

	@OnWebSocketError
	public void onError(Session socket, Throwable error) {
		if (!this.closed.get()) {
			logger.warn("Project {}: WebSocket error: {}", this.project, error.getMessage());
			logger.debug("WebSocket error detail", error);
		}
		terminate();
	}

	private void terminate() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		synchronized (this.outboundSink) {
			this.outboundSink.tryEmitComplete();
		}
		EdgeSession current = this.session;
		if (current != null) {
			this.coordinator.sessionClosed(this.project, current.generation());
		}
	}

	private void reply(RelayFrame frame) {
		send(frame).subscribe(null,
				error -> logger.debug("Project {}: reply not sent: {}", this.project, error.getMessage()));
	}

	// ---------------------------
	// RelaySessionChannel
	// ---------------------------

	@Override
	public Mono<Void> send(RelayFrame frame) {
		return Mono.defer(() -> {
			Sinks.One<Void> done = Sinks.one();
			Sinks.EmitResult result;
			synchronized (this.outboundSink) {
				result = this.closed.get() ? Sinks.EmitResult.FAIL_TERMINATED
						: this.outboundSink.tryEmitNext(new Outbound(frame, done));
			}
			if (result.isFailure()) {
				return Mono.error(new RelayException(RelayErrorKinds.CONNECTION_LOST, "Daemon connection is closed"));
			}
			return done.asMono();
		});
	}

	@Override
	public void close(int code, String reason) {
		Session current = this.socket;
		if (current != null && current.isOpen()) {
			current.close(code, reason, Callback.NOOP);
		}
	}

	@Override
	public boolean isOpen() {
		Session current = this.socket;
		return !this.closed.get() && current != null && current.isOpen();
	}

	private Mono<Void> write(RelayFrame frame) {
		return Mono.create(sink -> {
			Session current = this.socket;
			if (current == null || !current.isOpen()) {
				sink.error(new RelayException(RelayErrorKinds.CONNECTION_LOST, "Daemon connection is closed"));
				return;
			}
			String json;
			try {
				json = RelaySchema.serializeFrame(this.jsonMapper, frame);
			}
			catch (IOException e) {
				sink.error(e);
				return;
			}
			logger.debug("Project {}: sending {}", this.project, json);
			current.sendText(json, new Callback() {
				@Override
				public void succeed() {
					sink.success();
				}

				@Override
				public void fail(Throwable x) {
					sink.error(x);
				}
			});
		});
	}

	private record Outbound(RelayFrame frame, Sinks.One<Void> done) {
	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.daemon.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.openagentkit.relay.error.RelayErrorKinds;
import com.openagentkit.relay.error.RelayException;
import com.openagentkit.relay.spec.RelayClientTransport;
import com.openagentkit.relay.spec.RelaySchema;
import com.openagentkit.relay.spec.RelaySchema.RelayFrame;
import com.openagentkit.relay.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Relay transport for the local daemon over the JDK {@link java.net.http.WebSocket} API.
 *
 * <p>
 * The relay token is offered as the WebSocket sub-protocol, so the edge authenticates the
 * connection before any frame is exchanged. Frames travel as JSON text messages.
 * </p>
 *
 * <p>
 * Outbound frames are queued in a Reactor sink and written by a dedicated single-thread
 * scheduler, one complete message at a time.
 * </p>
 *
 * @author Oak Relay Contributors
 */
public class WebSocketRelayClientTransport implements RelayClientTransport {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketRelayClientTransport.class);

	private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);

	private final URI serverUri;

	private final String relayToken;

	private final McpJsonMapper jsonMapper;

	private final HttpClient httpClient;

	private final Sinks.Many<RelayFrame> outboundSink;

	private final Sinks.Empty<Void> terminationSink = Sinks.empty();

	private final Scheduler outboundScheduler;

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	private final AtomicBoolean isConnected = new AtomicBoolean(false);

	private volatile WebSocket webSocket;

	private Consumer<Throwable> exceptionHandler = t -> logger.error("Transport error", t);

	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * Creates a new transport with its own HttpClient.
	 * @param serverUri The WebSocket URI to connect to (e.g., "wss://relay.example.com/ws")
	 * @param relayToken The relay token presented during the handshake
	 * @param jsonMapper The JsonMapper to use for JSON serialization/deserialization
	 */
	public WebSocketRelayClientTransport(URI serverUri, String relayToken, McpJsonMapper jsonMapper) {
		this(serverUri, relayToken, jsonMapper, HttpClient.newBuilder()
			.executor(Executors.newCachedThreadPool())
			.build());
	}

	/**
	 * Creates a new transport with a custom HttpClient.
	 * @param serverUri The WebSocket URI to connect to
	 * @param relayToken The relay token presented during the handshake
	 * @param jsonMapper The JsonMapper to use for JSON serialization/deserialization
	 * @param httpClient The HttpClient to use for WebSocket connections
	 */
	public WebSocketRelayClientTransport(URI serverUri, String relayToken, McpJsonMapper jsonMapper,
			HttpClient httpClient) {
		Assert.notNull(serverUri, "The serverUri can not be null");
		Assert.hasText(relayToken, "The relay token can not be empty");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(httpClient, "The HttpClient can not be null");

		this.serverUri = serverUri;
		this.relayToken = relayToken;
		this.jsonMapper = jsonMapper;
		this.httpClient = httpClient;

		this.outboundSink = Sinks.many().unicast().onBackpressureBuffer();
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "relay-ws-client-outbound");
			t.setDaemon(true);
			return t;
		}), "relay-ws-client-outbound");
	}

	/**
	 * Returns a factory creating transports that share one HttpClient, so that reconnect
	 * attempts do not each spin up a new client.
	 * @param jsonMapper The JsonMapper to use for JSON serialization/deserialization
	 * @return the transport factory
	 */
	public static RelayClientTransport.Factory factory(McpJsonMapper jsonMapper) {
		HttpClient shared = HttpClient.newBuilder().executor(Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "relay-ws-client");
			t.setDaemon(true);
			return t;
		})).build();
		return (uri, token) -> new WebSocketRelayClientTransport(uri, token, jsonMapper, shared);
	}

	/**
	 * Sets the connection timeout for WebSocket establishment.
	 * @param timeout The connection timeout
	 * @return This transport for chaining
	 */
	public WebSocketRelayClientTransport connectTimeout(Duration timeout) {
		Assert.notNull(timeout, "Connect timeout must not be null");
		this.connectTimeout = timeout;
		return this;
	}

	@Override
	public Mono<Void> connect(Consumer<RelayFrame> inboundHandler) {
		Assert.notNull(inboundHandler, "Inbound handler must not be null");
		if (!isConnected.compareAndSet(false, true)) {
			return Mono.error(new IllegalStateException("Already connected"));
		}

		return Mono.fromFuture(() -> {
			logger.info("Connecting to relay at {}", serverUri);

			return httpClient.newWebSocketBuilder()
				.connectTimeout(connectTimeout)
				.subprotocols(relayToken)
				.buildAsync(serverUri, new RelayWebSocketListener(inboundHandler));
		}).doOnSuccess(ws -> {
			this.webSocket = ws;
			startOutboundProcessing();
			logger.info("WebSocket to relay at {} is open", serverUri);
		}).onErrorMap(WebSocketHandshakeException.class,
				e -> new RelayException(RelayErrorKinds.UNAUTHORIZED,
						"Relay rejected the handshake (HTTP " + e.getResponse().statusCode() + ")", e))
			.doOnError(e -> {
				logger.warn("Failed to connect to relay at {}: {}", serverUri, e.getMessage());
				isClosing.set(true);
				terminationSink.tryEmitError(e);
			})
			.then();
	}

	private void startOutboundProcessing() {
		this.outboundSink.asFlux().publishOn(outboundScheduler).subscribe(frame -> {
			WebSocket ws = this.webSocket;
			if (frame != null && !isClosing.get() && ws != null) {
				try {
					String json = RelaySchema.serializeFrame(jsonMapper, frame);
					logger.debug("Sending frame: {}", json);
					ws.sendText(json, true).join();
				}
				catch (Exception e) {
					if (!isClosing.get()) {
						logger.error("Error sending frame", e);
						exceptionHandler.accept(e);
					}
				}
			}
		});
	}

	@Override
	public Mono<Void> sendFrame(RelayFrame frame) {
		return Mono.defer(() -> {
			if (isClosing.get()) {
				return Mono.error(new RelayException(RelayErrorKinds.CONNECTION_LOST, "Transport is closed"));
			}
			Sinks.EmitResult result;
			synchronized (outboundSink) {
				result = outboundSink.tryEmitNext(frame);
			}
			if (result.isSuccess()) {
				return Mono.empty();
			}
			return Mono.error(new RelayException(RelayErrorKinds.CONNECTION_LOST, "Failed to enqueue frame: " + result));
		});
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			logger.debug("Relay transport closing gracefully");
			isClosing.set(true);
			synchronized (outboundSink) {
				outboundSink.tryEmitComplete();
			}
		}).then(Mono.defer(() -> {
			WebSocket ws = this.webSocket;
			if (ws != null && !ws.isOutputClosed()) {
				return Mono.fromFuture(ws.sendClose(WebSocket.NORMAL_CLOSURE, "Daemon disconnecting"))
					.timeout(CLOSE_TIMEOUT)
					.onErrorResume(e -> {
						logger.debug("Close handshake did not complete: {}", e.getMessage());
						return Mono.empty();
					})
					.doFinally(signal -> ws.abort())
					.then();
			}
			return Mono.empty();
		})).then(Mono.fromRunnable(() -> {
			terminationSink.tryEmitEmpty();
			outboundScheduler.dispose();
			logger.debug("Relay transport closed");
		}));
	}

	@Override
	public Mono<Void> awaitTermination() {
		return terminationSink.asMono();
	}

	@Override
	public void setExceptionHandler(Consumer<Throwable> handler) {
		this.exceptionHandler = handler;
	}

	/**
	 * WebSocket.Listener implementation handing complete text messages to the inbound
	 * handler.
	 */
	private class RelayWebSocketListener implements WebSocket.Listener {

		private final StringBuilder messageBuffer = new StringBuilder();

		private final Consumer<RelayFrame> inboundHandler;

		RelayWebSocketListener(Consumer<RelayFrame> inboundHandler) {
			this.inboundHandler = inboundHandler;
		}

		@Override
		public void onOpen(WebSocket webSocket) {
			logger.debug("WebSocket connection opened");
			webSocket.request(1);
		}

		@Override
		public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
			messageBuffer.append(data);

			if (last) {
				String message = messageBuffer.toString();
				messageBuffer.setLength(0);

				try {
					RelayFrame frame = RelaySchema.deserializeFrame(jsonMapper, message);
					inboundHandler.accept(frame);
				}
				catch (Exception e) {
					if (!isClosing.get()) {
						logger.warn("Dropping invalid frame from relay: {}", e.getMessage());
					}
				}
			}

			webSocket.request(1);
			return CompletableFuture.completedFuture(null);
		}

		@Override
		public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
			logger.info("Relay connection closed: {} - {}", statusCode, reason);
			isClosing.set(true);
			terminationSink.tryEmitEmpty();
			return CompletableFuture.completedFuture(null);
		}

		@Override
		public void onError(WebSocket webSocket, Throwable error) {
			if (!isClosing.get()) {
				logger.warn("Relay connection error: {}", error.getMessage());
				exceptionHandler.accept(error);
			}
			isClosing.set(true);
			terminationSink.tryEmitError(error);
		}

	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.daemon;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.openagentkit.relay.config.RelayEndpointConfig;
import com.openagentkit.relay.config.RelayTimings;
import com.openagentkit.relay.daemon.transport.WebSocketRelayClientTransport;
import com.openagentkit.relay.error.RelayErrorKinds;
import com.openagentkit.relay.error.RelayException;
import com.openagentkit.relay.spec.RelayClientTransport;
import com.openagentkit.relay.spec.RelaySchema.CallFrame;
import com.openagentkit.relay.spec.RelaySchema.ErrorFrame;
import com.openagentkit.relay.spec.RelaySchema.HeartbeatFrame;
import com.openagentkit.relay.spec.RelaySchema.RegisterFrame;
import com.openagentkit.relay.spec.RelaySchema.RegisteredFrame;
import com.openagentkit.relay.spec.RelaySchema.RelayFrame;
import com.openagentkit.relay.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the daemon's single outbound connection to the relay edge.
 *
 * <p>
 * The manager drives {@link ConnectionState} through handshake, registration, heartbeat
 * and reconnection. Every transition runs on one single-threaded connection loop, so
 * there is never more than one handshake in flight. Inbound {@code call} frames are
 * handed to the {@link LocalDispatcher} and answered on the same connection; neither
 * dispatch nor state observers run on the connection loop.
 * </p>
 *
 * <p>
 * Once {@link #connect()} has been called the manager reconnects after every loss, with
 * exponential backoff, until {@link #disconnect()} is called. Rejected handshakes back
 * off exactly like transport failures, since the edge does not tell the two apart.
 * </p>
 *
 * <pre>{@code
 * RelayConnectionManager manager = RelayConnectionManager.builder(config)
 *     .toolService(tools)
 *     .build();
 *
 * manager.connect().block();
 * manager.stateChanges().subscribe(state -> System.out.println("relay: " + state));
 * }</pre>
 *
 * @author Oak Relay Contributors
 */
public class RelayConnectionManager {

	private static final Logger logger = LoggerFactory.getLogger(RelayConnectionManager.class);

	/** Consecutive handshake rejections after which a possibly invalid token is reported. */
	static final int REJECTION_WARNING_THRESHOLD = 3;

	private final URI relayUri;

	private final String relayToken;

	private final RelayTimings timings;

	private final RelayClientTransport.Factory transportFactory;

	private final ToolExecutionService toolService;

	private final LocalDispatcher dispatcher;

	private final ReconnectBackoff backoff;

	private final Scheduler connectionLoop;

	private final boolean ownsConnectionLoop;

	private final Sinks.Many<ConnectionState> stateSink = Sinks.many().replay().latest();

	// Written only on the connection loop; volatile for status readers on other threads.

	private volatile ConnectionState state = ConnectionState.DISCONNECTED;

	private volatile long attemptId;

	private volatile boolean shouldReconnect;

	private volatile RelayClientTransport transport;

	private volatile Instant connectedAt;

	private volatile Instant lastInboundAt;

	private volatile String lastError;

	private volatile int reconnectAttempts;

	private volatile long generation;

	private int consecutiveRejections;

	private Sinks.One<RegisteredFrame> registration;

	private Disposable attemptSubscription;

	private Disposable terminationSubscription;

	private Disposable heartbeatTask;

	private Disposable reconnectTask;

	private RelayConnectionManager(Builder builder) {
		this.relayUri = builder.relayUri;
		this.relayToken = builder.relayToken;
		this.timings = builder.timings;
		this.toolService = builder.toolService;
		this.transportFactory = builder.transportFactory != null ? builder.transportFactory
				: WebSocketRelayClientTransport.factory(builder.jsonMapper);
		this.dispatcher = new LocalDispatcher(builder.toolService, builder.jsonMapper, builder.maxResponseBytes,
				builder.dispatchScheduler);
		this.backoff = builder.backoff;
		this.ownsConnectionLoop = builder.connectionLoop == null;
		this.connectionLoop = builder.connectionLoop != null ? builder.connectionLoop
				: Schedulers.newSingle("relay-connection", true);
		this.stateSink.tryEmitNext(ConnectionState.DISCONNECTED);
	}

	/**
	 * Starts building a manager for the provisioned relay endpoint.
	 * @param config base URL and credentials
	 * @return a new builder
	 */
	public static Builder builder(RelayEndpointConfig config) {
		Assert.notNull(config, "Relay endpoint config must not be null");
		return new Builder(config.relayUri(), config.credentials().relayToken());
	}

	/**
	 * Starts building a manager for an explicit WebSocket URI.
	 * @param relayUri the WebSocket URI of the relay
	 * @param relayToken the relay token
	 * @return a new builder
	 */
	public static Builder builder(URI relayUri, String relayToken) {
		return new Builder(relayUri, relayToken);
	}

	// ---------------------------
	// Public operations
	// ---------------------------

	/**
	 * Starts connecting and keeps the connection up until {@link #disconnect()}. If the
	 * manager is already connected or reconnecting this does nothing.
	 * @return a {@link Mono} emitting the status once the first attempt has either
	 * succeeded or failed; a failed attempt leaves the manager reconnecting in the
	 * background
	 */
	public Mono<RelayStatus> connect() {
		return Mono.create(sink -> this.connectionLoop.schedule(() -> {
			if (this.state != ConnectionState.DISCONNECTED) {
				sink.success(status());
				return;
			}
			this.shouldReconnect = true;
			startAttempt(() -> sink.success(status()));
		}));
	}

	/**
	 * Closes the connection, cancels any scheduled reconnect and suppresses reconnection
	 * until {@link #connect()} is called again.
	 * @return a {@link Mono} completing once the connection is closed
	 */
	public Mono<Void> disconnect() {
		return Mono.<RelayClientTransport>create(sink -> this.connectionLoop.schedule(() -> {
			this.shouldReconnect = false;
			this.attemptId++;
			Disposable attempt = this.attemptSubscription;
			this.attemptSubscription = null;
			cancelTasks();
			RelayClientTransport current = this.transport;
			this.transport = null;
			this.reconnectAttempts = 0;
			this.lastError = null;
			this.connectedAt = null;
			this.generation = 0;
			this.backoff.reset();
			transition(ConnectionState.DISCONNECTED);
			logger.info("Disconnected from relay at {}", this.relayUri);
			dispose(attempt);
			sink.success(current);
		})).flatMap(RelayClientTransport::closeGracefully);
	}

	/**
	 * Disconnects and releases the connection loop.
	 * @return a {@link Mono} completing once everything is released
	 */
	public Mono<Void> closeGracefully() {
		return disconnect().doFinally(signal -> {
			if (this.ownsConnectionLoop) {
				this.connectionLoop.dispose();
			}
		});
	}

	public ConnectionState state() {
		return this.state;
	}

	/**
	 * State transitions, starting with the current state. Observers run on the
	 * connection loop and must not block.
	 * @return the transitions
	 */
	public Flux<ConnectionState> stateChanges() {
		return this.stateSink.asFlux();
	}

	public RelayStatus status() {
		return new RelayStatus(this.state, this.relayUri, this.connectedAt, this.lastInboundAt, this.lastError,
				this.reconnectAttempts, this.generation);
	}

	/**
	 * The WebSocket URI this manager connects to.
	 * @return the relay URI
	 */
	public URI relayUri() {
		return this.relayUri;
	}

	// ---------------------------
	// Connection loop
	// ---------------------------

	private void startAttempt(Runnable onOutcome) {
		long id = ++this.attemptId;
		cancelTasks();
		transition(ConnectionState.CONNECTING);

		RelayClientTransport candidate;
		try {
			candidate = this.transportFactory.create(this.relayUri, this.relayToken);
		}
		catch (Exception e) {
			handleFailure(id, null, e);
			runQuietly(onOutcome);
			return;
		}
		candidate.setExceptionHandler(error -> logger.warn("Relay transport error: {}", error.getMessage()));
		this.transport = candidate;
		Sinks.One<RegisteredFrame> registered = Sinks.one();
		this.registration = registered;

		this.attemptSubscription = candidate.connect(frame -> onFrame(id, candidate, frame))
			.publishOn(this.connectionLoop)
			.then(Mono.fromRunnable(() -> {
				if (id == this.attemptId) {
					transition(ConnectionState.AUTHENTICATING);
					watchTermination(id, candidate);
				}
			}))
			.then(Mono.defer(this.toolService::listTools).onErrorResume(e -> {
				logger.warn("Could not list local tools for registration: {}", e.getMessage());
				return Mono.just(List.of());
			}))
			.flatMap(tools -> candidate.sendFrame(new RegisterFrame(tools)))
			.then(registered.asMono().timeout(this.timings.handshakeTimeout(), this.connectionLoop))
			.publishOn(this.connectionLoop)
			.doFinally(signal -> runQuietly(onOutcome))
			.subscribe(frame -> onRegistered(id, candidate, frame), error -> handleFailure(id, candidate, error));
	}

	private void watchTermination(long id, RelayClientTransport candidate) {
		this.terminationSubscription = candidate.awaitTermination()
			.publishOn(this.connectionLoop)
			.subscribe(null,
					error -> handleFailure(id, candidate,
							new RelayException(RelayErrorKinds.CONNECTION_LOST, "Connection failed: " + error.getMessage(),
									error)),
					() -> handleFailure(id, candidate,
							new RelayException(RelayErrorKinds.CONNECTION_LOST, "Connection closed by relay")));
	}

	private void onRegistered(long id, RelayClientTransport candidate, RegisteredFrame frame) {
		if (id != this.attemptId || this.state != ConnectionState.AUTHENTICATING) {
			return;
		}
		Instant now = now();
		this.connectedAt = now;
		this.lastInboundAt = now;
		this.generation = frame.generation();
		this.lastError = null;
		this.reconnectAttempts = 0;
		this.consecutiveRejections = 0;
		this.backoff.reset();
		transition(ConnectionState.CONNECTED);
		logger.info("Connected to relay at {} (generation {})", this.relayUri, frame.generation());

		this.heartbeatTask = Flux.interval(this.timings.heartbeatInterval(), this.connectionLoop)
			.subscribe(tick -> heartbeat(id, candidate));
	}

	private void heartbeat(long id, RelayClientTransport candidate) {
		if (id != this.attemptId || this.state != ConnectionState.CONNECTED) {
			return;
		}
		Instant now = now();
		Instant last = this.lastInboundAt;
		if (last != null && Duration.between(last, now).compareTo(this.timings.livenessWindow()) > 0) {
			logger.warn("No traffic from relay for {} ms, forcing reconnect", Duration.between(last, now).toMillis());
			handleFailure(id, candidate, new RelayException(RelayErrorKinds.CONNECTION_LOST, "Heartbeat timeout"));
			return;
		}
		candidate.sendFrame(new HeartbeatFrame(now.toString()))
			.subscribe(null, error -> logger.debug("Heartbeat not sent: {}", error.getMessage()));
	}

	private void handleFailure(long id, RelayClientTransport candidate, Throwable cause) {
		if (id != this.attemptId || this.state == ConnectionState.RECONNECTING
				|| this.state == ConnectionState.DISCONNECTED) {
			return;
		}
		// disposed last so a waiting connect() sees the outcome
		Disposable attempt = this.attemptSubscription;
		this.attemptSubscription = null;
		cancelTasks();
		if (candidate != null) {
			candidate.closeGracefully()
				.subscribe(null, error -> logger.debug("Error closing relay transport: {}", error.getMessage()));
		}
		this.transport = null;
		this.connectedAt = null;
		this.lastError = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
		trackRejection(cause);

		if (!this.shouldReconnect) {
			transition(ConnectionState.DISCONNECTED);
			dispose(attempt);
			return;
		}

		Duration delay = this.backoff.nextDelay();
		this.reconnectAttempts++;
		transition(ConnectionState.RECONNECTING);
		logger.info("Reconnecting to relay in {} ms (attempt {}): {}", delay.toMillis(), this.reconnectAttempts,
				this.lastError);
		this.reconnectTask = this.connectionLoop.schedule(() -> {
			if (this.shouldReconnect && this.state == ConnectionState.RECONNECTING) {
				startAttempt(null);
			}
		}, delay.toMillis(), TimeUnit.MILLISECONDS);
		dispose(attempt);
	}

	private void trackRejection(Throwable cause) {
		if (cause instanceof RelayException relayException
				&& RelayErrorKinds.UNAUTHORIZED.equals(relayException.getKind())) {
			this.consecutiveRejections++;
			if (this.consecutiveRejections == REJECTION_WARNING_THRESHOLD) {
				logger.warn("Relay rejected {} handshakes in a row; the relay token may be invalid. "
						+ "Still retrying with backoff.", this.consecutiveRejections);
			}
		}
		else {
			this.consecutiveRejections = 0;
		}
	}

	private void transition(ConnectionState next) {
		ConnectionState previous = this.state;
		if (previous == next) {
			return;
		}
		this.state = next;
		logger.info("Relay connection state {} -> {}", previous, next);
		this.stateSink.tryEmitNext(next);
	}

	private void cancelTasks() {
		dispose(this.attemptSubscription);
		dispose(this.terminationSubscription);
		dispose(this.heartbeatTask);
		dispose(this.reconnectTask);
		this.attemptSubscription = null;
		this.terminationSubscription = null;
		this.heartbeatTask = null;
		this.reconnectTask = null;
	}

	private static void dispose(Disposable disposable) {
		if (disposable != null) {
			disposable.dispose();
		}
	}

	private static void runQuietly(Runnable runnable) {
		if (runnable != null) {
			runnable.run();
		}
	}

	private Instant now() {
		return Instant.ofEpochMilli(this.connectionLoop.now(TimeUnit.MILLISECONDS));
	}

	// ---------------------------
	// Inbound frames (transport thread)
	// ---------------------------

	private void onFrame(long id, RelayClientTransport candidate, RelayFrame frame) {
		if (id != this.attemptId) {
			logger.debug("Ignoring frame from a replaced connection");
			return;
		}
		this.lastInboundAt = now();

		if (frame instanceof CallFrame call) {
			this.dispatcher.dispatch(call)
				.flatMap(candidate::sendFrame)
				.subscribe(null, error -> logger.warn("Could not send answer for call {}: {}", call.id(),
						error.getMessage()));
		}
		else if (frame instanceof HeartbeatFrame) {
			logger.trace("Heartbeat from relay");
		}
		else if (frame instanceof RegisteredFrame registered) {
			Sinks.One<RegisteredFrame> pending = this.registration;
			if (pending != null) {
				pending.tryEmitValue(registered);
			}
		}
		else if (frame instanceof ErrorFrame error) {
			if (error.id() == null) {
				logger.error("Relay reported error [{}]: {}", error.kind(), error.message());
				this.lastError = error.message();
				Sinks.One<RegisteredFrame> pending = this.registration;
				if (pending != null && this.state == ConnectionState.AUTHENTICATING) {
					pending.tryEmitError(new RelayException(error));
				}
			}
			else {
				logger.warn("Relay reported error [{}] for call {}: {}", error.kind(), error.id(), error.message());
			}
		}
		else {
			logger.warn("Ignoring unexpected {} frame from relay", frame.getClass().getSimpleName());
		}
	}

	/**
	 * Builder for {@link RelayConnectionManager}.
	 */
	public static class Builder {

		private final URI relayUri;

		private final String relayToken;

		private RelayTimings timings = RelayTimings.defaults();

		private ToolExecutionService toolService;

		private RelayClientTransport.Factory transportFactory;

		private McpJsonMapper jsonMapper;

		private int maxResponseBytes = LocalDispatcher.DEFAULT_MAX_RESPONSE_BYTES;

		private ReconnectBackoff backoff = new ReconnectBackoff();

		private Scheduler connectionLoop;

		private Scheduler dispatchScheduler = Schedulers.boundedElastic();

		private Builder(URI relayUri, String relayToken) {
			Assert.notNull(relayUri, "Relay URI must not be null");
			Assert.hasText(relayToken, "Relay token must not be empty");
			this.relayUri = relayUri;
			this.relayToken = relayToken;
		}

		/**
		 * Sets the heartbeat and handshake timings.
		 * @param timings the timings
		 * @return this builder
		 */
		public Builder timings(RelayTimings timings) {
			Assert.notNull(timings, "Timings must not be null");
			this.timings = timings;
			return this;
		}

		/**
		 * Sets the local service that executes relayed tool calls. Required.
		 * @param toolService the tool execution service
		 * @return this builder
		 */
		public Builder toolService(ToolExecutionService toolService) {
			Assert.notNull(toolService, "Tool execution service must not be null");
			this.toolService = toolService;
			return this;
		}

		/**
		 * Sets the factory creating one transport per connection attempt. Defaults to JDK
		 * WebSocket transports.
		 * @param transportFactory the transport factory
		 * @return this builder
		 */
		public Builder transportFactory(RelayClientTransport.Factory transportFactory) {
			Assert.notNull(transportFactory, "Transport factory must not be null");
			this.transportFactory = transportFactory;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "The JsonMapper can not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		/**
		 * Sets the largest serialized response frame relayed as-is; larger results are
		 * replaced by a {@code response_too_large} error.
		 * @param maxResponseBytes the limit in bytes
		 * @return this builder
		 */
		public Builder maxResponseBytes(int maxResponseBytes) {
			Assert.isTrue(maxResponseBytes > 0, "Max response bytes must be positive");
			this.maxResponseBytes = maxResponseBytes;
			return this;
		}

		public Builder backoff(ReconnectBackoff backoff) {
			Assert.notNull(backoff, "Backoff must not be null");
			this.backoff = backoff;
			return this;
		}

		/**
		 * Sets the single-threaded scheduler that serializes state transitions and times
		 * heartbeats and backoff. Defaults to a dedicated daemon thread.
		 * @param connectionLoop the scheduler
		 * @return this builder
		 */
		public Builder connectionLoop(Scheduler connectionLoop) {
			Assert.notNull(connectionLoop, "Connection loop must not be null");
			this.connectionLoop = connectionLoop;
			return this;
		}

		public Builder dispatchScheduler(Scheduler dispatchScheduler) {
			Assert.notNull(dispatchScheduler, "Dispatch scheduler must not be null");
			this.dispatchScheduler = dispatchScheduler;
			return this;
		}

		public RelayConnectionManager build() {
			Assert.notNull(this.toolService, "Tool execution service must be set");
			if (this.jsonMapper == null) {
				this.jsonMapper = McpJsonMapper.getDefault();
			}
			return new RelayConnectionManager(this);
		}

	}

}

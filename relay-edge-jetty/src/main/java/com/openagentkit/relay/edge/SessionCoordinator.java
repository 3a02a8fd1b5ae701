/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import com.openagentkit.relay.config.RelayCredentials;
import com.openagentkit.relay.config.RelayTimings;
import com.openagentkit.relay.error.RelayErrorKinds;
import com.openagentkit.relay.error.RelayException;
import com.openagentkit.relay.spec.RelaySchema.CallFrame;
import com.openagentkit.relay.spec.RelaySchema.ErrorFrame;
import com.openagentkit.relay.spec.RelaySchema.RelayFrame;
import com.openagentkit.relay.spec.RelaySchema.ResponseFrame;
import com.openagentkit.relay.spec.RelaySchema.ToolDescriptor;
import com.openagentkit.relay.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Edge-side owner of daemon sessions and the calls in flight on them.
 *
 * <p>
 * For every project the coordinator keeps at most one live {@link EdgeSession} and the
 * {@link PendingRequest}s routed through it. All mutation of a project's state happens
 * under that project's lock; different projects never contend. Pending requests are
 * settled outside the lock, so callers awaiting a result never run while it is held.
 * </p>
 *
 * <p>
 * Registration follows "newest wins": a daemon registering while an older session is
 * still open replaces it, and every request pending on the old session fails with
 * {@code superseded}. Answers are matched by call id and by the generation of the
 * session that carried the call, so a late answer from a replaced socket is dropped.
 * </p>
 *
 * @author Oak Relay Contributors
 */
public class SessionCoordinator implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SessionCoordinator.class);

	private final CredentialStore credentialStore;

	private final RelayTimings timings;

	private final Scheduler scheduler;

	private final Map<String, ProjectRoute> routes = new ConcurrentHashMap<>();

	private volatile Disposable reaper;

	public SessionCoordinator(CredentialStore credentialStore, RelayTimings timings) {
		this(credentialStore, timings, Schedulers.parallel());
	}

	/**
	 * Creates a coordinator.
	 * @param credentialStore provisioned project credentials
	 * @param timings liveness window and request timeout
	 * @param scheduler times request deadlines and the stale-session reaper, and supplies
	 * the clock
	 */
	public SessionCoordinator(CredentialStore credentialStore, RelayTimings timings, Scheduler scheduler) {
		Assert.notNull(credentialStore, "Credential store must not be null");
		Assert.notNull(timings, "Timings must not be null");
		Assert.notNull(scheduler, "Scheduler must not be null");
		this.credentialStore = credentialStore;
		this.timings = timings;
		this.scheduler = scheduler;
	}

	public RelayTimings timings() {
		return this.timings;
	}

	// ---------------------------
	// Authentication
	// ---------------------------

	/**
	 * Checks a daemon's relay token.
	 * @param project the project id
	 * @param relayToken the presented token, may be {@code null}
	 * @return {@code true} if the project exists and the token matches
	 */
	public boolean authenticateRelay(String project, String relayToken) {
		return this.credentialStore.find(project).map(c -> c.matchesRelayToken(relayToken)).orElse(false);
	}

	/**
	 * Checks an agent's token.
	 * @param project the project id
	 * @param agentToken the presented token, may be {@code null}
	 * @return {@code true} if the project exists and the token matches
	 */
	public boolean authenticateAgent(String project, String agentToken) {
		return this.credentialStore.find(project).map(c -> c.matchesAgentToken(agentToken)).orElse(false);
	}

	public boolean isKnownProject(String project) {
		return this.credentialStore.find(project).isPresent();
	}

	// ---------------------------
	// Sessions
	// ---------------------------

	/**
	 * Installs a new session for the project, replacing any live one.
	 * @param project the project id
	 * @param relayToken the token the daemon presented when connecting
	 * @param channel the connection the session writes to
	 * @param tools tools advertised by the daemon
	 * @return the new session
	 * @throws RelayException of kind {@code unauthorized} if the token does not match
	 */
	public EdgeSession register(String project, String relayToken, RelaySessionChannel channel,
			List<ToolDescriptor> tools) {
		Assert.notNull(channel, "Channel must not be null");
		if (!authenticateRelay(project, relayToken)) {
			throw new RelayException(RelayErrorKinds.UNAUTHORIZED, "Relay token rejected");
		}

		ProjectRoute route = this.routes.computeIfAbsent(project, ProjectRoute::new);
		Eviction eviction;
		EdgeSession session;
		synchronized (route) {
			eviction = route.evict(RelayErrorKinds.SUPERSEDED);
			route.generation++;
			session = new EdgeSession(project, route.generation, channel, now(), tools);
			route.session = session;
		}

		if (eviction != null) {
			logger.info("Project {}: generation {} superseded by generation {}", project,
					eviction.session.generation(), session.generation());
			eviction.settle(RelayException.superseded(eviction.session.generation()), RelaySessionChannel.CLOSE_SUPERSEDED,
					"Superseded by a newer connection");
		}
		logger.info("Project {}: session registered (generation {}, {} tools)", project, session.generation(),
				session.tools().size());
		return session;
	}

	/**
	 * Replaces the tool catalog advertised by a session.
	 * @return {@code false} if the generation is not the live one
	 */
	public boolean updateTools(String project, long generation, List<ToolDescriptor> tools) {
		EdgeSession session = liveSession(project, generation);
		if (session == null) {
			return false;
		}
		session.tools(tools);
		session.touch(now());
		return true;
	}

	/**
	 * Records traffic from a session.
	 * @return {@code false} if the generation is not the live one
	 */
	public boolean heartbeat(String project, long generation) {
		EdgeSession session = liveSession(project, generation);
		if (session == null) {
			logger.debug("Project {}: heartbeat from stale generation {}", project, generation);
			return false;
		}
		session.touch(now());
		return true;
	}

	/**
	 * Ends a session whose connection has closed. Requests pending on it fail with
	 * {@code connection_lost}. Nothing happens if the generation was already replaced.
	 * @param project the project id
	 * @param generation the generation of the closed session
	 */
	public void sessionClosed(String project, long generation) {
		ProjectRoute route = route(project);
		if (route == null) {
			return;
		}
		Eviction eviction;
		synchronized (route) {
			if (route.session == null || route.session.generation() != generation) {
				return;
			}
			eviction = route.evict(RelayErrorKinds.CONNECTION_LOST);
		}
		logger.info("Project {}: session closed (generation {}, {} pending)", project, generation,
				eviction.pending.size());
		eviction.settle(RelayException.connectionLost(generation), RelaySessionChannel.CLOSE_NORMAL, "Session closed");
	}

	/**
	 * Replaces a project's credentials and ends its live session. Requests pending on it
	 * fail with {@code credentials_rotated}.
	 * @param project the project id
	 * @param credentials the new credential pair
	 */
	public void rotateCredentials(String project, RelayCredentials credentials) {
		Assert.hasText(project, "Project must not be empty");
		this.credentialStore.put(project, credentials);
		ProjectRoute route = route(project);
		if (route == null) {
			return;
		}
		Eviction eviction;
		synchronized (route) {
			eviction = route.evict(RelayErrorKinds.CREDENTIALS_ROTATED);
		}
		logger.info("Project {}: credentials rotated", project);
		if (eviction != null) {
			eviction.settle(new RelayException(RelayErrorKinds.CREDENTIALS_ROTATED, "Relay credentials were rotated"),
					RelaySessionChannel.CLOSE_CREDENTIALS_ROTATED, "Credentials rotated");
		}
	}

	/**
	 * Closes every session that has been silent for longer than the liveness window.
	 * @return the number of sessions closed
	 */
	public int reapStaleSessions() {
		Instant now = now();
		Duration window = this.timings.livenessWindow();
		List<Eviction> evictions = new ArrayList<>();
		for (ProjectRoute route : this.routes.values()) {
			synchronized (route) {
				EdgeSession session = route.session;
				if (session != null && Duration.between(session.lastInboundAt(), now).compareTo(window) > 0) {
					evictions.add(route.evict(RelayErrorKinds.CONNECTION_LOST));
				}
			}
		}
		for (Eviction eviction : evictions) {
			logger.warn("Project {}: no heartbeat from generation {} within {} ms, closing session",
					eviction.session.project(), eviction.session.generation(), window.toMillis());
			eviction.settle(RelayException.connectionLost(eviction.session.generation()),
					RelaySessionChannel.CLOSE_HEARTBEAT_TIMEOUT, "Heartbeat timeout");
		}
		return evictions.size();
	}

	// ---------------------------
	// Calls
	// ---------------------------

	/**
	 * Forwards a call to the project's live session.
	 * @param project the project id
	 * @param call the call; its id must be unique among the project's pending calls
	 * @param timeout how long to wait for the answer
	 * @return a {@link Mono} emitting the daemon's response or error frame; it errors
	 * with a {@link RelayException} of kind {@code offline} at once when no session is
	 * live, and later with {@code timeout}, {@code superseded}, {@code connection_lost}
	 * or {@code credentials_rotated}. Cancelling it retires the pending request.
	 */
	public Mono<RelayFrame> routeCall(String project, CallFrame call, Duration timeout) {
		Assert.notNull(call, "Call must not be null");
		Assert.notNull(timeout, "Timeout must not be null");
		return Mono.defer(() -> {
			ProjectRoute route = route(project);
			if (route == null) {
				return Mono.error(RelayException.offline(project));
			}
			EdgeSession session;
			PendingRequest pending;
			synchronized (route) {
				session = route.session;
				if (session == null) {
					return Mono.error(RelayException.offline(project));
				}
				if (route.pending.containsKey(call.id())) {
					return Mono.error(new RelayException(RelayErrorKinds.BAD_REQUEST,
							"Call id already in flight: " + call.id()));
				}
				pending = new PendingRequest(call.id(), session.generation());
				route.pending.put(call.id(), pending);
			}

			pending.deadline(this.scheduler.schedule(() -> expire(project, pending), timeout.toMillis(),
					TimeUnit.MILLISECONDS));
			logger.debug("Project {}: routing call {} ({}) to generation {}", project, call.id(), call.method(),
					session.generation());

			session.channel()
				.send(call)
				.subscribe(null, error -> {
					logger.warn("Project {}: could not forward call {}: {}", project, call.id(), error.getMessage());
					if (remove(project, pending)) {
						pending.fail(RelayException.connectionLost(session.generation()));
					}
				});

			return pending.result().doOnCancel(() -> retire(project, call.id()));
		});
	}

	/**
	 * Delivers a daemon's answer to the request waiting for it.
	 * @param project the project id
	 * @param generation the generation of the session the answer arrived on
	 * @param frame a response or error frame
	 * @return {@code true} if a waiting request was fulfilled; stale, unknown or already
	 * settled answers are dropped and return {@code false}
	 */
	public boolean completeResponse(String project, long generation, RelayFrame frame) {
		String id = correlationId(frame);
		if (id == null) {
			return false;
		}
		ProjectRoute route = route(project);
		if (route == null) {
			return false;
		}
		PendingRequest pending;
		synchronized (route) {
			if (route.session == null || route.session.generation() != generation) {
				logger.debug("Project {}: dropping answer {} from stale generation {}", project, id, generation);
				return false;
			}
			route.session.touch(now());
			pending = route.pending.get(id);
			if (pending == null || pending.generation() != generation) {
				logger.debug("Project {}: dropping answer for unknown call {}", project, id);
				return false;
			}
			route.pending.remove(id);
		}
		return pending.complete(frame);
	}

	/**
	 * Removes a pending request whose caller is no longer waiting. A late answer for it
	 * is then dropped.
	 * @param project the project id
	 * @param id the call id
	 */
	public void retire(String project, String id) {
		ProjectRoute route = route(project);
		if (route == null) {
			return;
		}
		PendingRequest pending;
		synchronized (route) {
			pending = route.pending.remove(id);
		}
		if (pending != null) {
			logger.debug("Project {}: retired call {}", project, id);
			pending.fail(new RelayException(RelayErrorKinds.TIMEOUT, "Caller stopped waiting for " + id));
		}
	}

	private void expire(String project, PendingRequest pending) {
		if (remove(project, pending)) {
			logger.warn("Project {}: call {} timed out", project, pending.id());
			pending.fail(RelayException.timeout(pending.id()));
		}
	}

	private boolean remove(String project, PendingRequest pending) {
		ProjectRoute route = route(project);
		if (route == null) {
			return false;
		}
		synchronized (route) {
			return route.pending.remove(pending.id(), pending);
		}
	}

	private static String correlationId(RelayFrame frame) {
		if (frame instanceof ResponseFrame response) {
			return response.id();
		}
		if (frame instanceof ErrorFrame error) {
			return error.id();
		}
		return null;
	}

	// ---------------------------
	// Queries
	// ---------------------------

	public boolean isOnline(String project) {
		ProjectRoute route = route(project);
		if (route == null) {
			return false;
		}
		synchronized (route) {
			return route.session != null;
		}
	}

	/**
	 * Liveness for the health endpoint.
	 * @param project the project id
	 * @return the project's health, or empty if the project is not hosted here
	 */
	public Optional<ProjectHealth> health(String project) {
		if (!isKnownProject(project)) {
			return Optional.empty();
		}
		EdgeSession session = currentSession(project);
		if (session == null) {
			return Optional.of(ProjectHealth.offline(project));
		}
		return Optional.of(new ProjectHealth(project, true, session.generation(), session.connectedAt(),
				session.lastInboundAt(), session.tools().size()));
	}

	/**
	 * Tools advertised by the live session.
	 * @param project the project id
	 * @return the tool catalog, empty when offline
	 */
	public List<ToolDescriptor> tools(String project) {
		EdgeSession session = currentSession(project);
		return session != null ? session.tools() : List.of();
	}

	/**
	 * Number of calls currently awaiting an answer for a project.
	 * @param project the project id
	 * @return the pending call count
	 */
	public int pendingCount(String project) {
		ProjectRoute route = route(project);
		if (route == null) {
			return 0;
		}
		synchronized (route) {
			return route.pending.size();
		}
	}

	EdgeSession currentSession(String project) {
		ProjectRoute route = route(project);
		if (route == null) {
			return null;
		}
		synchronized (route) {
			return route.session;
		}
	}

	private ProjectRoute route(String project) {
		return project != null ? this.routes.get(project) : null;
	}

	private EdgeSession liveSession(String project, long generation) {
		EdgeSession session = currentSession(project);
		return session != null && session.generation() == generation ? session : null;
	}

	// ---------------------------
	// Lifecycle
	// ---------------------------

	/**
	 * Starts the periodic stale-session reaper, running once per heartbeat interval.
	 */
	public synchronized void start() {
		if (this.reaper == null) {
			this.reaper = Flux.interval(this.timings.heartbeatInterval(), this.scheduler)
				.subscribe(tick -> reapStaleSessions(),
						error -> logger.error("Stale-session reaper stopped", error));
		}
	}

	/**
	 * Stops the reaper and ends every session. Pending requests fail with
	 * {@code connection_lost}.
	 */
	@Override
	public synchronized void close() {
		if (this.reaper != null) {
			this.reaper.dispose();
			this.reaper = null;
		}
		for (ProjectRoute route : this.routes.values()) {
			Eviction eviction;
			synchronized (route) {
				eviction = route.evict(RelayErrorKinds.CONNECTION_LOST);
			}
			if (eviction != null) {
				eviction.settle(RelayException.connectionLost(eviction.session.generation()),
						RelaySessionChannel.CLOSE_GOING_AWAY, "Relay shutting down");
			}
		}
	}

	private Instant now() {
		return Instant.ofEpochMilli(this.scheduler.now(TimeUnit.MILLISECONDS));
	}

	/**
	 * Per-project state. Guarded by its own monitor.
	 */
	private static final class ProjectRoute {

		private final String project;

		private final Map<String, PendingRequest> pending = new HashMap<>();

		private EdgeSession session;

		private long generation;

		ProjectRoute(String project) {
			this.project = project;
		}

		/**
		 * Detaches the live session and its pending requests. Caller holds the lock.
		 */
		Eviction evict(String kind) {
			EdgeSession current = this.session;
			if (current == null) {
				return null;
			}
			this.session = null;
			List<PendingRequest> owned = new ArrayList<>();
			Iterator<PendingRequest> it = this.pending.values().iterator();
			while (it.hasNext()) {
				PendingRequest request = it.next();
				if (request.generation() == current.generation()) {
					owned.add(request);
					it.remove();
				}
			}
			logger.debug("Project {}: evicting generation {} ({})", this.project, current.generation(), kind);
			return new Eviction(current, owned);
		}

	}

	/**
	 * A session taken out of its route, settled outside the lock.
	 */
	private record Eviction(EdgeSession session, List<PendingRequest> pending) {

		void settle(RelayException error, int closeCode, String closeReason) {
			for (PendingRequest request : this.pending) {
				request.fail(error);
			}
			this.session.channel().close(closeCode, closeReason);
		}

	}

}

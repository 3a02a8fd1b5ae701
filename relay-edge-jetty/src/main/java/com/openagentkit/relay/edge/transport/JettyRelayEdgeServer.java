/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge.transport;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import com.openagentkit.relay.edge.EdgeRoute;
import com.openagentkit.relay.edge.RelayRequestFacade;
import com.openagentkit.relay.edge.SessionCoordinator;
import com.openagentkit.relay.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.websocket.server.ServerUpgradeRequest;
import org.eclipse.jetty.websocket.server.ServerUpgradeResponse;
import org.eclipse.jetty.websocket.server.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Embedded Jetty server hosting the relay edge: the daemon WebSocket endpoint and the
 * agent HTTP endpoints, for every project known to the {@link SessionCoordinator}.
 *
 * <p>
 * Daemons authenticate during the upgrade by offering their relay token as the first
 * {@code Sec-WebSocket-Protocol} value, which is echoed back as the accepted
 * sub-protocol; an {@code Authorization: Bearer} header is accepted instead. A bad
 * token is refused with 401 before any frame is exchanged.
 * </p>
 *
 * <p>
 * <b>Note:</b> requires the Jetty WebSocket server dependency:
 * <pre>{@code
 * <dependency>
 *     <groupId>org.eclipse.jetty.websocket</groupId>
 *     <artifactId>jetty-websocket-jetty-server</artifactId>
 *     <version>12.0.14</version>
 * </dependency>
 * }</pre>
 *
 * @author Oak Relay Contributors
 */
public class JettyRelayEdgeServer {

	private static final Logger logger = LoggerFactory.getLogger(JettyRelayEdgeServer.class);

	/** Project addressed by paths without a {@code /projects/{project}} prefix. */
	public static final String DEFAULT_PROJECT = "default";

	private static final String PROJECT_WS_PATH_SPEC = "regex|^/projects/[^/]+/ws$";

	private final int port;

	private final SessionCoordinator coordinator;

	private final McpJsonMapper jsonMapper;

	private final AtomicBoolean isStarted = new AtomicBoolean(false);

	private String defaultProject = DEFAULT_PROJECT;

	private Duration idleTimeout;

	private Server server;

	private ServerConnector connector;

	/**
	 * Creates a server.
	 * @param port the port to listen on, {@code 0} for an ephemeral port
	 * @param coordinator the session coordinator
	 * @param jsonMapper the JsonMapper to use for frames and HTTP bodies
	 */
	public JettyRelayEdgeServer(int port, SessionCoordinator coordinator, McpJsonMapper jsonMapper) {
		Assert.isTrue(port >= 0, "Port must not be negative");
		Assert.notNull(coordinator, "Coordinator must not be null");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		this.port = port;
		this.coordinator = coordinator;
		this.jsonMapper = jsonMapper;
		this.idleTimeout = coordinator.timings().livenessWindow().multipliedBy(2);
	}

	/**
	 * Sets the project addressed by unprefixed paths.
	 * @param project the project id
	 * @return this server for chaining
	 */
	public JettyRelayEdgeServer defaultProject(String project) {
		Assert.hasText(project, "Default project must not be empty");
		this.defaultProject = project;
		return this;
	}

	/**
	 * Sets the WebSocket idle timeout. Defaults to twice the liveness window.
	 * @param timeout the idle timeout
	 * @return this server for chaining
	 */
	public JettyRelayEdgeServer idleTimeout(Duration timeout) {
		Assert.notNull(timeout, "Idle timeout must not be null");
		this.idleTimeout = timeout;
		return this;
	}

	/**
	 * The port the server listens on; the bound port once started with port {@code 0}.
	 * @return the port
	 */
	public int getPort() {
		return this.connector != null ? this.connector.getLocalPort() : this.port;
	}

	/**
	 * Base HTTP URL of the running server.
	 * @return e.g. {@code http://localhost:8080}
	 */
	public URI baseUri() {
		return URI.create("http://localhost:" + getPort());
	}

	public Mono<Void> start() {
		if (!this.isStarted.compareAndSet(false, true)) {
			return Mono.error(new IllegalStateException("Already started"));
		}
		return Mono.fromCallable(() -> {
			logger.info("Starting relay edge on port {}", this.port);

			this.server = new Server();
			this.connector = new ServerConnector(this.server);
			this.connector.setPort(this.port);
			this.server.addConnector(this.connector);

			WebSocketUpgradeHandler wsHandler = WebSocketUpgradeHandler.from(this.server, container -> {
				container.setIdleTimeout(this.idleTimeout);
				container.addMapping(EdgeRoute.Endpoint.WS.path(), this::createEndpoint);
				container.addMapping(PROJECT_WS_PATH_SPEC, this::createEndpoint);
			});
			wsHandler.setHandler(new RelayHttpHandler(new RelayRequestFacade(this.coordinator, this.jsonMapper),
					this.defaultProject));
			this.server.setHandler(wsHandler);

			this.server.start();
			this.coordinator.start();

			logger.info("Relay edge started on port {}", getPort());
			return null;
		}).then();
	}

	private Object createEndpoint(ServerUpgradeRequest request, ServerUpgradeResponse response, Callback callback) {
		EdgeRoute route = EdgeRoute.parse(Request.getPathInContext(request), this.defaultProject).orElse(null);
		if (route == null) {
			Response.writeError(request, response, callback, 404);
			return null;
		}

		List<String> subProtocols = request.getSubProtocols();
		String token = !subProtocols.isEmpty() ? subProtocols.get(0)
				: RelayRequestFacade.extractToken(request.getHeaders().get(HttpHeader.AUTHORIZATION));
		if (!this.coordinator.authenticateRelay(route.project(), token)) {
			logger.warn("Project {}: rejected daemon connection from {}", route.project(),
					Request.getRemoteAddr(request));
			Response.writeError(request, response, callback, 401);
			return null;
		}
		if (!subProtocols.isEmpty()) {
			response.setAcceptedSubProtocol(token);
		}
		return new RelayWebSocketEndpoint(route.project(), token, this.coordinator, this.jsonMapper);
	}

	public Mono<Void> closeGracefully() {
		return Mono.fromCallable(() -> {
			logger.debug("Relay edge closing gracefully");
			this.coordinator.close();
			if (this.server != null) {
				this.server.stop();
			}
			logger.debug("Relay edge closed");
			return null;
		}).then();
	}

}

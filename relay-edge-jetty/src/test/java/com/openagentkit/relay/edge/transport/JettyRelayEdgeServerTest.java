/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge.transport;

import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.openagentkit.relay.config.RelayCredentials;
import com.openagentkit.relay.config.RelayTimings;
import com.openagentkit.relay.daemon.ConnectionState;
import com.openagentkit.relay.daemon.RelayConnectionManager;
import com.openagentkit.relay.daemon.RelayStatus;
import com.openagentkit.relay.daemon.ToolExecutionService;
import com.openagentkit.relay.edge.InMemoryCredentialStore;
import com.openagentkit.relay.edge.SessionCoordinator;
import com.openagentkit.relay.error.RelayException;
import com.openagentkit.relay.spec.RelaySchema.ToolDescriptor;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests: a real Jetty edge on an ephemeral port, a connection manager using
 * the JDK WebSocket client, and agent calls over HTTP.
 *
 * @author Oak Relay Contributors
 */
class JettyRelayEdgeServerTest {

	private static final Duration TIMEOUT = Duration.ofSeconds(10);

	private static final RelayTimings TIMINGS = new RelayTimings(Duration.ofSeconds(1), 3, Duration.ofSeconds(5),
			Duration.ofSeconds(5));

	private final McpJsonMapper jsonMapper = McpJsonMapper.getDefault();

	private final HttpClient httpClient = HttpClient.newHttpClient();

	private final RelayCredentials credentials = RelayCredentials.generate();

	private SessionCoordinator coordinator;

	private JettyRelayEdgeServer server;

	private RelayConnectionManager manager;

	@BeforeEach
	void setUp() {
		InMemoryCredentialStore store = InMemoryCredentialStore.of(JettyRelayEdgeServer.DEFAULT_PROJECT,
				this.credentials);
		store.put("oak-42", this.credentials);
		this.coordinator = new SessionCoordinator(store, TIMINGS);
		this.server = new JettyRelayEdgeServer(0, this.coordinator, this.jsonMapper);
		this.server.start().block(TIMEOUT);
	}

	@AfterEach
	void tearDown() {
		if (this.manager != null) {
			this.manager.closeGracefully().block(TIMEOUT);
		}
		this.server.closeGracefully().block(TIMEOUT);
	}

	private RelayConnectionManager daemon(String path, String relayToken) {
		ToolExecutionService tools = new ToolExecutionService() {
			@Override
			public Mono<Object> execute(String method, Map<String, Object> params) {
				if ("oak_search".equals(method)) {
					return Mono.just(Map.of("query", params.get("query"), "hits", List.of("auth.py")));
				}
				if ("oak_hang".equals(method)) {
					return Mono.never();
				}
				if ("oak_fail".equals(method)) {
					return Mono.error(new IllegalStateException("index locked"));
				}
				return Mono.error(RelayException.unknownMethod(method));
			}

			@Override
			public Mono<List<ToolDescriptor>> listTools() {
				return Mono.just(List.of(new ToolDescriptor("oak_search"), new ToolDescriptor("oak_fail")));
			}
		};
		this.manager = RelayConnectionManager
			.builder(URI.create("ws://localhost:" + this.server.getPort() + path), relayToken)
			.toolService(tools)
			.timings(TIMINGS)
			.build();
		return this.manager;
	}

	private HttpResponse<String> post(String path, String token, String body) throws Exception {
		HttpRequest.Builder request = HttpRequest.newBuilder(this.server.baseUri().resolve(path))
			.timeout(TIMEOUT)
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body));
		if (token != null) {
			request.header("Authorization", "Bearer " + token);
		}
		return this.httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
	}

	private HttpResponse<String> get(String path, String token) throws Exception {
		HttpRequest.Builder request = HttpRequest.newBuilder(this.server.baseUri().resolve(path)).timeout(TIMEOUT);
		if (token != null) {
			request.header("Authorization", "Bearer " + token);
		}
		return this.httpClient.send(request.GET().build(), HttpResponse.BodyHandlers.ofString());
	}

	private Map<String, Object> json(HttpResponse<String> response) throws Exception {
		return this.jsonMapper.readValue(response.body(), new TypeRef<Map<String, Object>>() {
		});
	}

	private void awaitPending(int count, Duration within) {
		Mono.fromCallable(() -> this.coordinator.pendingCount(JettyRelayEdgeServer.DEFAULT_PROJECT))
			.filter(pending -> pending == count)
			.repeatWhenEmpty(attempts -> attempts.delayElements(Duration.ofMillis(50)))
			.block(within);
	}

	private void awaitOnline(String project, boolean online) {
		Mono.fromCallable(() -> this.coordinator.isOnline(project))
			.filter(state -> state == online)
			.repeatWhenEmpty(attempts -> attempts.delayElements(Duration.ofMillis(50)))
			.block(TIMEOUT);
	}

	@Test
	void daemonConnectsAndServesAgentCalls() throws Exception {
		RelayStatus status = daemon("/ws", this.credentials.relayToken()).connect().block(TIMEOUT);

		assertThat(status.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(status.generation()).isEqualTo(1);

		HttpResponse<String> response = post("/relay", this.credentials.agentToken(),
				"{\"method\":\"oak_search\",\"params\":{\"query\":\"auth\"},\"id\":\"a-1\"}");

		assertThat(response.statusCode()).isEqualTo(200);
		Map<String, Object> body = json(response);
		assertThat(body).containsEntry("id", "a-1");
		assertThat(body.get("result")).isEqualTo(Map.of("query", "auth", "hits", List.of("auth.py")));
		assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("*");
	}

	@Test
	void healthAndToolsReflectRegisteredDaemon() throws Exception {
		assertThat(json(get("/health", null))).containsEntry("instance_connected", false);

		daemon("/ws", this.credentials.relayToken()).connect().block(TIMEOUT);

		HttpResponse<String> health = get("/health", null);
		assertThat(health.statusCode()).isEqualTo(200);
		assertThat(json(health)).containsEntry("instance_connected", true);
		assertThat(health.body()).doesNotContain(this.credentials.relayToken())
			.doesNotContain(this.credentials.agentToken());

		HttpResponse<String> tools = get("/tools", this.credentials.agentToken());
		assertThat(tools.statusCode()).isEqualTo(200);
		assertThat(tools.body()).contains("oak_search").contains("oak_fail");
		assertThat(get("/tools", null).statusCode()).isEqualTo(401);
	}

	@Test
	void toolAndProtocolErrorsAreRendered() throws Exception {
		daemon("/ws", this.credentials.relayToken()).connect().block(TIMEOUT);

		HttpResponse<String> toolError = post("/relay", this.credentials.agentToken(), "{\"method\":\"oak_fail\"}");
		HttpResponse<String> unknown = post("/relay", this.credentials.agentToken(), "{\"method\":\"oak_nope\"}");

		assertThat(toolError.statusCode()).isEqualTo(200);
		assertThat(json(toolError)).containsEntry("reason", "tool_error").containsEntry("error", "index locked");
		assertThat(unknown.statusCode()).isEqualTo(400);
		assertThat(json(unknown)).containsEntry("reason", "unknown_method");
	}

	@Test
	void agentErrorsWithoutDaemon() throws Exception {
		assertThat(post("/relay", "wrong", "{\"method\":\"oak_search\"}").statusCode()).isEqualTo(401);
		assertThat(post("/relay", this.credentials.agentToken(), "not json").statusCode()).isEqualTo(400);

		HttpResponse<String> offline = post("/relay", this.credentials.agentToken(), "{\"method\":\"oak_search\"}");
		assertThat(offline.statusCode()).isEqualTo(503);
		assertThat(json(offline)).containsEntry("reason", "offline");
	}

	@Test
	void badRelayTokenIsRejectedDuringHandshake() {
		RelayStatus status = daemon("/ws", "not-the-token").connect().block(TIMEOUT);

		assertThat(status.state()).isEqualTo(ConnectionState.RECONNECTING);
		assertThat(status.error()).contains("401");
		assertThat(this.coordinator.isOnline(JettyRelayEdgeServer.DEFAULT_PROJECT)).isFalse();
	}

	@Test
	void namedProjectIsAddressedByPrefix() throws Exception {
		daemon("/projects/oak-42/ws", this.credentials.relayToken()).connect().block(TIMEOUT);

		assertThat(this.coordinator.isOnline("oak-42")).isTrue();
		assertThat(this.coordinator.isOnline(JettyRelayEdgeServer.DEFAULT_PROJECT)).isFalse();
		HttpResponse<String> response = post("/projects/oak-42/relay", this.credentials.agentToken(),
				"{\"method\":\"oak_search\",\"params\":{\"query\":\"x\"}}");
		assertThat(response.statusCode()).isEqualTo(200);
	}

	@Test
	void disconnectTakesProjectOffline() throws Exception {
		RelayConnectionManager daemon = daemon("/ws", this.credentials.relayToken());
		daemon.connect().block(TIMEOUT);
		awaitOnline(JettyRelayEdgeServer.DEFAULT_PROJECT, true);

		daemon.disconnect().block(TIMEOUT);
		awaitOnline(JettyRelayEdgeServer.DEFAULT_PROJECT, false);

		assertThat(post("/relay", this.credentials.agentToken(), "{\"method\":\"oak_search\"}").statusCode())
			.isEqualTo(503);
	}

	@Test
	void clientClosingSocketRetiresPendingCall() throws Exception {
		daemon("/ws", this.credentials.relayToken()).connect().block(TIMEOUT);
		byte[] body = "{\"method\":\"oak_hang\",\"id\":\"slow\"}".getBytes(StandardCharsets.UTF_8);
		String head = "POST /relay HTTP/1.1\r\n" + "Host: localhost\r\n" + "Authorization: Bearer "
				+ this.credentials.agentToken() + "\r\n" + "Content-Type: application/json\r\n" + "Content-Length: "
				+ body.length + "\r\n\r\n";

		try (Socket socket = new Socket("localhost", this.server.getPort())) {
			OutputStream out = socket.getOutputStream();
			out.write(head.getBytes(StandardCharsets.US_ASCII));
			out.write(body);
			out.flush();
			awaitPending(1, TIMEOUT);
		}

		// well inside the 5s request timeout
		awaitPending(0, Duration.ofSeconds(2));
		assertThat(this.coordinator.isOnline(JettyRelayEdgeServer.DEFAULT_PROJECT)).isTrue();
	}

	@Test
	void mcpClientsCanListAndCallTools() throws Exception {
		daemon("/ws", this.credentials.relayToken()).connect().block(TIMEOUT);

		HttpResponse<String> list = post("/mcp", this.credentials.agentToken(),
				"{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");
		HttpResponse<String> call = post("/sse", this.credentials.agentToken(),
				"{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\","
						+ "\"params\":{\"name\":\"oak_search\",\"arguments\":{\"query\":\"auth\"}}}");

		assertThat(list.statusCode()).isEqualTo(200);
		assertThat(list.body()).contains("oak_search").contains("oak_fail");
		assertThat(call.statusCode()).isEqualTo(200);
		Map<String, Object> body = json(call);
		assertThat(body).containsEntry("id", 2).doesNotContainKey("error");
		assertThat(call.body()).contains("auth.py");
		assertThat(post("/mcp", "wrong", "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"initialize\"}").statusCode())
			.isEqualTo(401);
	}

	@Test
	void preflightIsAnswered() throws Exception {
		HttpRequest request = HttpRequest.newBuilder(this.server.baseUri().resolve("/relay"))
			.method("OPTIONS", HttpRequest.BodyPublishers.noBody())
			.timeout(TIMEOUT)
			.build();

		HttpResponse<String> response = this.httpClient.send(request, HttpResponse.BodyHandlers.ofString());

		assertThat(response.statusCode()).isEqualTo(204);
		assertThat(response.headers().firstValue("Access-Control-Allow-Methods")).isPresent();
	}

	@Test
	void unknownPathIsNotFound() throws Exception {
		assertThat(get("/nowhere", null).statusCode()).isEqualTo(404);
	}

}

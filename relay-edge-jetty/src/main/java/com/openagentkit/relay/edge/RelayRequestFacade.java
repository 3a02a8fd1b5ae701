/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.openagentkit.relay.error.RelayErrorKinds;
import com.openagentkit.relay.error.RelayException;
import com.openagentkit.relay.spec.RelaySchema.CallFrame;
import com.openagentkit.relay.spec.RelaySchema.ErrorFrame;
import com.openagentkit.relay.spec.RelaySchema.RelayFrame;
import com.openagentkit.relay.spec.RelaySchema.ResponseFrame;
import com.openagentkit.relay.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Translates agent HTTP requests into relayed calls and their outcomes back into HTTP
 * responses. Independent of the HTTP server hosting it.
 *
 * <p>
 * Error bodies have the shape {@code {"error": "<message>", "reason": "<kind>"}} so an
 * agent can tell an offline instance from a timeout or a bad request.
 * </p>
 *
 * @author Oak Relay Contributors
 */
public class RelayRequestFacade {

	private static final Logger logger = LoggerFactory.getLogger(RelayRequestFacade.class);

	/** Reason reported when the tool itself failed. */
	public static final String REASON_TOOL_ERROR = "tool_error";

	private static final String BEARER_SCHEME = "Bearer";

	private static final TypeRef<Map<String, Object>> BODY_TYPE_REF = new TypeRef<>() {
	};

	private static final String FALLBACK_BODY = "{\"error\":\"Internal error\",\"reason\":\"internal_error\"}";

	/** MCP protocol revision announced by {@code initialize}. */
	public static final String MCP_PROTOCOL_VERSION = "2025-03-26";

	/** Server name announced by {@code initialize}. */
	public static final String MCP_SERVER_NAME = "oak-cloud-relay";

	static final String MCP_SERVER_VERSION = "1.0.0";

	private static final String JSONRPC_VERSION = "2.0";

	private final SessionCoordinator coordinator;

	private final McpJsonMapper jsonMapper;

	private final Duration requestTimeout;

	public RelayRequestFacade(SessionCoordinator coordinator, McpJsonMapper jsonMapper) {
		this(coordinator, jsonMapper, coordinator.timings().requestTimeout());
	}

	public RelayRequestFacade(SessionCoordinator coordinator, McpJsonMapper jsonMapper, Duration requestTimeout) {
		Assert.notNull(coordinator, "Coordinator must not be null");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(requestTimeout, "Request timeout must not be null");
		this.coordinator = coordinator;
		this.jsonMapper = jsonMapper;
		this.requestTimeout = requestTimeout;
	}

	/**
	 * Handles {@code POST /relay}.
	 * @param project the addressed project
	 * @param authorization the {@code Authorization} header, may be {@code null}
	 * @param body the request body
	 * @return the response; never errors
	 */
	public Mono<RelayHttpResponse> handleRelay(String project, String authorization, String body) {
		if (!this.coordinator.authenticateAgent(project, extractToken(authorization))) {
			return Mono.just(error(401, RelayErrorKinds.UNAUTHORIZED, "Invalid or missing agent token"));
		}

		Map<String, Object> request;
		try {
			request = parseBody(body);
		}
		catch (IllegalArgumentException e) {
			logger.debug("Project {}: rejected relay body: {}", project, e.getMessage());
			return Mono.just(error(400, RelayErrorKinds.BAD_REQUEST, e.getMessage()));
		}

		Object agentId = request.get("id");
		@SuppressWarnings("unchecked")
		Map<String, Object> params = (Map<String, Object>) request.get("params");
		CallFrame call = new CallFrame(UUID.randomUUID().toString(), (String) request.get("method"), params);

		return this.coordinator.routeCall(project, call, this.requestTimeout)
			.map(frame -> render(agentId, frame))
			.onErrorResume(RelayException.class, e -> Mono.just(failure(agentId, e)))
			.onErrorResume(e -> {
				logger.error("Project {}: unexpected failure relaying {}", project, call.method(), e);
				return Mono.just(error(500, "internal_error", "Internal error"));
			});
	}

	/**
	 * Handles an MCP JSON-RPC request at {@code POST /mcp}. {@code initialize} and
	 * {@code tools/list} are answered by the edge from the registered catalog;
	 * {@code tools/call} is relayed to the daemon like {@code POST /relay} and its result
	 * returned as a single text content block. Requests without an id are notifications
	 * and are acknowledged with 202.
	 * @param project the addressed project
	 * @param authorization the {@code Authorization} header, may be {@code null}
	 * @param body the JSON-RPC request
	 * @return the response; never errors
	 */
	public Mono<RelayHttpResponse> handleMcp(String project, String authorization, String body) {
		if (!this.coordinator.authenticateAgent(project, extractToken(authorization))) {
			return Mono.just(error(401, RelayErrorKinds.UNAUTHORIZED, "Invalid or missing agent token"));
		}

		if (body == null || body.isBlank()) {
			return Mono.just(rpcError(400, null, McpErrorCodes.PARSE_ERROR, "Parse error", null));
		}
		Object parsed;
		try {
			parsed = this.jsonMapper.readValue(body, Object.class);
		}
		catch (IOException | RuntimeException e) {
			logger.debug("Project {}: unparseable MCP request: {}", project, e.getMessage());
			return Mono.just(rpcError(400, null, McpErrorCodes.PARSE_ERROR, "Parse error", null));
		}
		if (!(parsed instanceof Map<?, ?> request)) {
			return Mono.just(rpcError(null, McpErrorCodes.INVALID_REQUEST, "Invalid JSON-RPC request"));
		}

		Object id = request.get("id");
		boolean validId = id == null || id instanceof String || id instanceof Number;
		Object method = request.get("method");
		if (!JSONRPC_VERSION.equals(request.get("jsonrpc")) || !validId || !(method instanceof String name)
				|| name.isBlank()) {
			return Mono.just(rpcError(validId ? id : null, McpErrorCodes.INVALID_REQUEST, "Invalid JSON-RPC request"));
		}
		if (!request.containsKey("id")) {
			logger.debug("Project {}: MCP notification {}", project, name);
			return Mono.just(new RelayHttpResponse(202, ""));
		}
		Object params = request.get("params");
		if (params != null && !(params instanceof Map)) {
			return Mono.just(rpcError(id, McpErrorCodes.INVALID_PARAMS, "params must be an object"));
		}

		logger.debug("Project {}: MCP {}", project, name);
		return switch (name) {
			case "initialize" -> Mono.just(rpcResult(id, initializeResult()));
			case "ping" -> Mono.just(rpcResult(id, Map.of()));
			case "tools/list" -> Mono.just(rpcResult(id, Map.of("tools", this.coordinator.tools(project))));
			case "tools/call" -> callTool(project, id, params != null ? (Map<?, ?>) params : Map.of());
			default -> Mono.just(rpcError(id, McpErrorCodes.METHOD_NOT_FOUND, "Method not found: " + name));
		};
	}

	/**
	 * Handles {@code GET /health}. Unauthenticated and free of secrets.
	 * @param project the addressed project
	 * @return the response
	 */
	public RelayHttpResponse handleHealth(String project) {
		return this.coordinator.health(project).map(health -> {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("status", "ok");
			body.put("project", health.project());
			body.put("instance_connected", health.online());
			if (health.online()) {
				body.put("generation", health.generation());
				body.put("connected_at", health.connectedAt().toString());
				body.put("last_heartbeat_at", health.lastHeartbeatAt().toString());
				body.put("tool_count", health.toolCount());
			}
			return json(200, body);
		}).orElseGet(() -> error(404, RelayErrorKinds.UNKNOWN_PROJECT, "Unknown project"));
	}

	/**
	 * Handles {@code GET /tools}.
	 * @param project the addressed project
	 * @param authorization the {@code Authorization} header, may be {@code null}
	 * @return the response
	 */
	public RelayHttpResponse handleTools(String project, String authorization) {
		if (!this.coordinator.authenticateAgent(project, extractToken(authorization))) {
			return error(401, RelayErrorKinds.UNAUTHORIZED, "Invalid or missing agent token");
		}
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("instance_connected", this.coordinator.isOnline(project));
		body.put("tools", this.coordinator.tools(project));
		return json(200, body);
	}

	/**
	 * Extracts the token from an {@code Authorization} header, accepting both
	 * {@code Bearer <token>} and a bare token.
	 * @param authorization the header value, may be {@code null}
	 * @return the token, or {@code null} if none was presented
	 */
	public static String extractToken(String authorization) {
		if (authorization == null) {
			return null;
		}
		String value = authorization.trim();
		int scheme = BEARER_SCHEME.length();
		if (value.regionMatches(true, 0, BEARER_SCHEME, 0, scheme)
				&& (value.length() == scheme || Character.isWhitespace(value.charAt(scheme)))) {
			value = value.substring(scheme).trim();
		}
		return value.isEmpty() ? null : value;
	}

	/**
	 * HTTP status for a failure kind raised while routing or awaiting a call.
	 * @param kind the error kind
	 * @return the status code
	 */
	static int statusFor(String kind) {
		if (RelayErrorKinds.OFFLINE.equals(kind) || RelayErrorKinds.SUPERSEDED.equals(kind)
				|| RelayErrorKinds.CREDENTIALS_ROTATED.equals(kind)) {
			return 503;
		}
		if (RelayErrorKinds.TIMEOUT.equals(kind) || RelayErrorKinds.CONNECTION_LOST.equals(kind)) {
			return 504;
		}
		if (RelayErrorKinds.UNAUTHORIZED.equals(kind)) {
			return 401;
		}
		if (RelayErrorKinds.UNKNOWN_PROJECT.equals(kind)) {
			return 404;
		}
		return 400;
	}

	private Mono<RelayHttpResponse> callTool(String project, Object id, Map<?, ?> params) {
		if (!(params.get("name") instanceof String tool) || tool.isBlank()) {
			return Mono.just(rpcError(id, McpErrorCodes.INVALID_PARAMS, "Missing required parameter: name"));
		}
		Object arguments = params.get("arguments");
		if (arguments != null && !(arguments instanceof Map)) {
			return Mono.just(rpcError(id, McpErrorCodes.INVALID_PARAMS, "arguments must be an object"));
		}
		@SuppressWarnings("unchecked")
		Map<String, Object> args = (Map<String, Object>) arguments;
		CallFrame call = new CallFrame(UUID.randomUUID().toString(), tool, args);

		return this.coordinator.routeCall(project, call, this.requestTimeout)
			.map(frame -> renderToolResult(id, frame))
			.onErrorResume(RelayException.class,
					e -> Mono.just(rpcError(id, McpErrorCodes.RELAY_ERROR, e.getMessage(), e.getKind())))
			.onErrorResume(e -> {
				logger.error("Project {}: unexpected failure relaying MCP call to {}", project, tool, e);
				return Mono.just(rpcError(id, McpErrorCodes.INTERNAL_ERROR, "Internal error", null));
			});
	}

	private RelayHttpResponse renderToolResult(Object id, RelayFrame frame) {
		if (frame instanceof ResponseFrame response) {
			String text;
			try {
				text = this.jsonMapper.writeValueAsString(response.result());
			}
			catch (IOException e) {
				logger.error("Could not serialize tool result for MCP call {}", id, e);
				return rpcError(id, McpErrorCodes.INTERNAL_ERROR, "Tool result is not serializable", null);
			}
			Map<String, Object> content = new LinkedHashMap<>();
			content.put("type", "text");
			content.put("text", text);
			return rpcResult(id, Map.of("content", List.of(content)));
		}
		if (frame instanceof ErrorFrame errorFrame) {
			String message = errorFrame.message() != null ? errorFrame.message()
					: RelayErrorKinds.getDescription(errorFrame.kind());
			return rpcError(id, McpErrorCodes.RELAY_ERROR, message, errorFrame.kind());
		}
		return rpcError(id, McpErrorCodes.RELAY_ERROR, "Unexpected answer from instance",
				RelayErrorKinds.PROTOCOL_ERROR);
	}

	private static Map<String, Object> initializeResult() {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("protocolVersion", MCP_PROTOCOL_VERSION);
		result.put("capabilities", Map.of("tools", Map.of("listChanged", false)));
		result.put("serverInfo", Map.of("name", MCP_SERVER_NAME, "version", MCP_SERVER_VERSION));
		return result;
	}

	private RelayHttpResponse rpcResult(Object id, Object result) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("jsonrpc", JSONRPC_VERSION);
		body.put("id", id);
		body.put("result", result);
		return json(200, body);
	}

	private RelayHttpResponse rpcError(Object id, int code, String message) {
		return rpcError(200, id, code, message, null);
	}

	private RelayHttpResponse rpcError(Object id, int code, String message, String reason) {
		return rpcError(200, id, code, message, reason);
	}

	private RelayHttpResponse rpcError(int status, Object id, int code, String message, String reason) {
		Map<String, Object> error = new LinkedHashMap<>();
		error.put("code", code);
		error.put("message", message);
		if (reason != null) {
			error.put("data", Map.of("reason", reason));
		}
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("jsonrpc", JSONRPC_VERSION);
		body.put("id", id);
		body.put("error", error);
		return json(status, body);
	}

	private Map<String, Object> parseBody(String body) {
		if (body == null || body.isBlank()) {
			throw new IllegalArgumentException("Request body is empty");
		}
		Map<String, Object> request;
		try {
			request = this.jsonMapper.readValue(body, BODY_TYPE_REF);
		}
		catch (IOException | RuntimeException e) {
			throw new IllegalArgumentException("Request body is not a JSON object");
		}
		if (request == null) {
			throw new IllegalArgumentException("Request body is not a JSON object");
		}
		Object method = request.get("method");
		if (!(method instanceof String name) || name.isBlank()) {
			throw new IllegalArgumentException("Request body requires a method");
		}
		Object params = request.get("params");
		if (params != null && !(params instanceof Map)) {
			throw new IllegalArgumentException("params must be a JSON object");
		}
		Object id = request.get("id");
		if (id instanceof Map || id instanceof List) {
			throw new IllegalArgumentException("id must be a string or a number");
		}
		return request;
	}

	private RelayHttpResponse render(Object agentId, RelayFrame frame) {
		if (frame instanceof ResponseFrame response) {
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("id", agentId);
			body.put("result", response.result());
			return json(200, body);
		}
		if (frame instanceof ErrorFrame errorFrame) {
			boolean toolLevel = RelayErrorKinds.isToolLevel(errorFrame.kind());
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("id", agentId);
			body.put("error", errorFrame.message() != null ? errorFrame.message()
					: RelayErrorKinds.getDescription(errorFrame.kind()));
			body.put("reason", toolLevel ? REASON_TOOL_ERROR : errorFrame.kind());
			body.put("kind", errorFrame.kind());
			return json(toolLevel ? 200 : 400, body);
		}
		return error(502, RelayErrorKinds.PROTOCOL_ERROR, "Unexpected answer from instance");
	}

	private RelayHttpResponse failure(Object agentId, RelayException e) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("id", agentId);
		body.put("error", e.getMessage());
		body.put("reason", e.getKind());
		return json(statusFor(e.getKind()), body);
	}

	private RelayHttpResponse error(int status, String reason, String message) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("error", message);
		body.put("reason", reason);
		return json(status, body);
	}

	private RelayHttpResponse json(int status, Map<String, Object> body) {
		try {
			return new RelayHttpResponse(status, this.jsonMapper.writeValueAsString(body));
		}
		catch (IOException e) {
			logger.error("Could not serialize response body", e);
			return new RelayHttpResponse(500, FALLBACK_BODY);
		}
	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.error;

import java.util.Set;

/**
 * Machine-readable error kinds carried by {@code error} frames and by the {@code reason}
 * field of the agent-facing HTTP responses.
 *
 * <p>
 * Kinds fall in three groups:
 * <ul>
 * <li>Tool-level: the tool ran (or tried to) and failed. Rendered to the agent as a
 * successful HTTP exchange carrying a structured error.</li>
 * <li>Protocol-level: the call itself was not acceptable (unknown method, bad
 * parameters, malformed frame).</li>
 * <li>Relay-level: the relay could not deliver the call or its answer (offline, timeout,
 * superseded session, lost connection, authentication).</li>
 * </ul>
 *
 * @author Oak Relay Contributors
 */
public final class RelayErrorKinds {

	private RelayErrorKinds() {
	}

	// Tool-level

	public static final String TOOL_EXECUTION_FAILED = "tool_execution_failed";

	public static final String RESPONSE_TOO_LARGE = "response_too_large";

	// Protocol-level

	public static final String UNKNOWN_METHOD = "unknown_method";

	public static final String INVALID_PARAMS = "invalid_params";

	public static final String PROTOCOL_ERROR = "protocol_error";

	// Relay-level

	public static final String OFFLINE = "offline";

	public static final String SUPERSEDED = "superseded";

	public static final String CREDENTIALS_ROTATED = "credentials_rotated";

	public static final String CONNECTION_LOST = "connection_lost";

	public static final String TIMEOUT = "timeout";

	public static final String UNAUTHORIZED = "unauthorized";

	public static final String BAD_REQUEST = "bad_request";

	public static final String UNKNOWN_PROJECT = "unknown_project";

	private static final Set<String> TOOL_LEVEL = Set.of(TOOL_EXECUTION_FAILED, RESPONSE_TOO_LARGE);

	private static final Set<String> PROTOCOL_LEVEL = Set.of(UNKNOWN_METHOD, INVALID_PARAMS, PROTOCOL_ERROR);

	/**
	 * Returns whether the kind reports a failure of the tool itself.
	 * @param kind the error kind
	 * @return true for tool-level kinds
	 */
	public static boolean isToolLevel(String kind) {
		return kind != null && TOOL_LEVEL.contains(kind);
	}

	/**
	 * Returns whether the kind reports an unacceptable call.
	 * @param kind the error kind
	 * @return true for protocol-level kinds
	 */
	public static boolean isProtocolLevel(String kind) {
		return kind != null && PROTOCOL_LEVEL.contains(kind);
	}

	/**
	 * Returns a human-readable description for an error kind.
	 * @param kind the error kind
	 * @return a description, or "Unknown error" for unrecognized kinds
	 */
	public static String getDescription(String kind) {
		if (kind == null) {
			return "Unknown error";
		}
		return switch (kind) {
			case TOOL_EXECUTION_FAILED -> "Tool execution failed";
			case RESPONSE_TOO_LARGE -> "Response too large";
			case UNKNOWN_METHOD -> "Unknown method";
			case INVALID_PARAMS -> "Invalid params";
			case PROTOCOL_ERROR -> "Protocol error";
			case OFFLINE -> "No instance connected";
			case SUPERSEDED -> "Session superseded";
			case CREDENTIALS_ROTATED -> "Credentials rotated";
			case CONNECTION_LOST -> "Connection lost";
			case TIMEOUT -> "Timed out";
			case UNAUTHORIZED -> "Unauthorized";
			case BAD_REQUEST -> "Bad request";
			case UNKNOWN_PROJECT -> "Unknown project";
			default -> "Unknown error";
		};
	}

}

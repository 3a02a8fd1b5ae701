/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

/**
 * JSON-RPC error codes returned by the MCP endpoint.
 *
 * @author Oak Relay Contributors
 */
public final class McpErrorCodes {

	/** Invalid JSON was received. */
	public static final int PARSE_ERROR = -32700;

	/** The JSON sent is not a valid request object. */
	public static final int INVALID_REQUEST = -32600;

	/** The method does not exist or is not available. */
	public static final int METHOD_NOT_FOUND = -32601;

	/** Invalid method parameters. */
	public static final int INVALID_PARAMS = -32602;

	/** Internal JSON-RPC error. */
	public static final int INTERNAL_ERROR = -32603;

	/** The relayed tool call failed; {@code data.reason} carries the relay error kind. */
	public static final int RELAY_ERROR = -32000;

	private McpErrorCodes() {
	}

}

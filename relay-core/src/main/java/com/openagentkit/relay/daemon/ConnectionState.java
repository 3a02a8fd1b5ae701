/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.daemon;

/**
 * Lifecycle of the daemon's single outbound relay connection.
 *
 * <pre>
 * DISCONNECTED -> CONNECTING -> AUTHENTICATING -> CONNECTED
 *                     ^                                |
 *                     +-------- RECONNECTING <---------+
 * </pre>
 *
 * Any state moves to {@link #DISCONNECTED} on an explicit disconnect.
 */
public enum ConnectionState {

	/** No connection and no reconnect scheduled. */
	DISCONNECTED,

	/** Opening the WebSocket. */
	CONNECTING,

	/** Socket open, waiting for the edge to acknowledge registration. */
	AUTHENTICATING,

	/** Registered; calls are being relayed. */
	CONNECTED,

	/** Connection lost; waiting out the backoff before the next attempt. */
	RECONNECTING;

	public boolean isConnected() {
		return this == CONNECTED;
	}

}

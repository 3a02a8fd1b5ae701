/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.daemon;

import java.net.URI;
import java.time.Instant;

/**
 * Point-in-time snapshot of the daemon's relay connection, for status output.
 *
 * @param state the connection state
 * @param relayUri the WebSocket URI the daemon connects to
 * @param connectedAt when the current connection was registered, or {@code null}
 * @param lastHeartbeatAt when traffic was last received from the edge, or {@code null}
 * @param error the last connection error, or {@code null}
 * @param reconnectAttempts reconnect attempts since the last successful connection
 * @param generation generation assigned by the edge to the current connection, or 0
 *
 * @author Oak Relay Contributors
 */
public record RelayStatus(ConnectionState state, URI relayUri, Instant connectedAt, Instant lastHeartbeatAt,
		String error, int reconnectAttempts, long generation) {

	public boolean connected() {
		return this.state == ConnectionState.CONNECTED;
	}

}

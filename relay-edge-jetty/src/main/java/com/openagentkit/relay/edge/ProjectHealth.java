/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import java.time.Instant;

/**
 * Liveness of one project as shown to unauthenticated callers. Carries no token
 * material.
 *
 * @param project the project id
 * @param online whether a daemon session is live
 * @param generation the live session's generation, {@code 0} when offline
 * @param connectedAt when the live session registered, {@code null} when offline
 * @param lastHeartbeatAt last traffic from the daemon, {@code null} when offline
 * @param toolCount number of tools the live session advertised
 */
public record ProjectHealth(String project, boolean online, long generation, Instant connectedAt,
		Instant lastHeartbeatAt, int toolCount) {

	static ProjectHealth offline(String project) {
		return new ProjectHealth(project, false, 0, null, null, 0);
	}

}

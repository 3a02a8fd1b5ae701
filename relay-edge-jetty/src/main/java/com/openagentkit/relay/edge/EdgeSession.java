/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import java.time.Instant;
import java.util.List;

import com.openagentkit.relay.spec.RelaySchema.ToolDescriptor;

/**
 * One registered daemon connection for a project. A session is identified by its
 * generation; a project has at most one live session at a time.
 *
 * @author Oak Relay Contributors
 */
public final class EdgeSession {

	private final String project;

	private final long generation;

	private final RelaySessionChannel channel;

	private final Instant connectedAt;

	private volatile Instant lastInboundAt;

	private volatile List<ToolDescriptor> tools;

	EdgeSession(String project, long generation, RelaySessionChannel channel, Instant connectedAt,
			List<ToolDescriptor> tools) {
		this.project = project;
		this.generation = generation;
		this.channel = channel;
		this.connectedAt = connectedAt;
		this.lastInboundAt = connectedAt;
		this.tools = tools != null ? List.copyOf(tools) : List.of();
	}

	public String project() {
		return this.project;
	}

	public long generation() {
		return this.generation;
	}

	public RelaySessionChannel channel() {
		return this.channel;
	}

	public Instant connectedAt() {
		return this.connectedAt;
	}

	/**
	 * When the daemon was last heard from. Any inbound frame counts.
	 * @return the time of the last inbound frame
	 */
	public Instant lastInboundAt() {
		return this.lastInboundAt;
	}

	public List<ToolDescriptor> tools() {
		return this.tools;
	}

	void touch(Instant now) {
		this.lastInboundAt = now;
	}

	void tools(List<ToolDescriptor> tools) {
		this.tools = tools != null ? List.copyOf(tools) : List.of();
	}

	@Override
	public String toString() {
		return "EdgeSession{project=" + this.project + ", generation=" + this.generation + "}";
	}

}

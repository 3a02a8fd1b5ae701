/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import com.openagentkit.relay.edge.EdgeRoute.Endpoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EdgeRoute}.
 *
 * @author Oak Relay Contributors
 */
class EdgeRouteTest {

	@Test
	void unprefixedPathsAddressDefaultProject() {
		assertThat(EdgeRoute.parse("/ws", "default")).contains(new EdgeRoute("default", Endpoint.WS));
		assertThat(EdgeRoute.parse("/relay", "default")).contains(new EdgeRoute("default", Endpoint.RELAY));
		assertThat(EdgeRoute.parse("/health/", "default")).contains(new EdgeRoute("default", Endpoint.HEALTH));
		assertThat(EdgeRoute.parse("/tools", "default")).contains(new EdgeRoute("default", Endpoint.TOOLS));
		assertThat(EdgeRoute.parse("/mcp", "default")).contains(new EdgeRoute("default", Endpoint.MCP));
		assertThat(EdgeRoute.parse("/sse", "default")).contains(new EdgeRoute("default", Endpoint.MCP));
	}

	@Test
	void prefixedPathsAddressNamedProject() {
		assertThat(EdgeRoute.parse("/projects/oak-42/relay", "default"))
			.contains(new EdgeRoute("oak-42", Endpoint.RELAY));
		assertThat(EdgeRoute.parse("/projects/oak-42/ws", "default")).contains(new EdgeRoute("oak-42", Endpoint.WS));
		assertThat(EdgeRoute.parse("/projects/oak-42/mcp", "default")).contains(new EdgeRoute("oak-42", Endpoint.MCP));
	}

	@Test
	void unknownPathsResolveToNothing() {
		assertThat(EdgeRoute.parse("/", "default")).isEmpty();
		assertThat(EdgeRoute.parse("/rpc", "default")).isEmpty();
		assertThat(EdgeRoute.parse("/projects/", "default")).isEmpty();
		assertThat(EdgeRoute.parse("/projects/oak-42", "default")).isEmpty();
		assertThat(EdgeRoute.parse("/projects/oak-42/relay/extra", "default")).isEmpty();
		assertThat(EdgeRoute.parse(null, "default")).isEmpty();
	}

}

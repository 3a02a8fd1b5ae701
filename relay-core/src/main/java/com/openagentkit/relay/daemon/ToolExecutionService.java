/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.daemon;

import java.util.List;
import java.util.Map;

import com.openagentkit.relay.spec.RelaySchema;
import reactor.core.publisher.Mono;

/**
 * The local service that actually runs tools. The relay treats it as opaque: it hands
 * over a method name and parameters and relays back whatever comes out.
 *
 * <p>
 * Implementations signal an unknown tool by failing with a
 * {@link com.openagentkit.relay.error.RelayException} of kind
 * {@link com.openagentkit.relay.error.RelayErrorKinds#UNKNOWN_METHOD}; any other failure
 * is reported to the agent as a tool execution failure.
 * </p>
 *
 * @author Oak Relay Contributors
 */
public interface ToolExecutionService {

	/**
	 * Executes a tool.
	 * @param method the tool name
	 * @param params the tool arguments
	 * @return the tool result
	 */
	Mono<Object> execute(String method, Map<String, Object> params);

	/**
	 * Lists the tools advertised to the edge when the daemon registers.
	 * @return the tool catalog
	 */
	default Mono<List<RelaySchema.ToolDescriptor>> listTools() {
		return Mono.just(List.of());
	}

}

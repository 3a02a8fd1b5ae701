/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

/**
 * Status and JSON body of an agent-facing HTTP response.
 *
 * @param status the HTTP status code
 * @param body the JSON body
 */
public record RelayHttpResponse(int status, String body) {

}

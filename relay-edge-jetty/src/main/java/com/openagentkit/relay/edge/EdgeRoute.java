/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import java.util.List;
import java.util.Optional;

/**
 * A request path resolved to a project and an endpoint.
 *
 * <p>
 * {@code /ws}, {@code /relay}, {@code /mcp}, {@code /health} and {@code /tools} address
 * the default project; {@code /projects/{project}/ws} and so on address a named one.
 * </p>
 *
 * @param project the addressed project
 * @param endpoint the addressed endpoint
 *
 * @author Oak Relay Contributors
 */
public record EdgeRoute(String project, Endpoint endpoint) {

	public static final String PROJECTS_PREFIX = "/projects/";

	public enum Endpoint {

		/** Daemon WebSocket upgrade. */
		WS("/ws"),

		/** Agent call. */
		RELAY("/relay"),

		/** Unauthenticated liveness. */
		HEALTH("/health"),

		/** Agent tool catalog. */
		TOOLS("/tools"),

		/** MCP JSON-RPC over HTTP; {@code /sse} is kept for clients configured with it. */
		MCP("/mcp", "/sse");

		private final String path;

		private final List<String> aliases;

		Endpoint(String path, String... aliases) {
			this.path = path;
			this.aliases = List.of(aliases);
		}

		public String path() {
			return this.path;
		}

		static Optional<Endpoint> fromPath(String path) {
			for (Endpoint endpoint : values()) {
				if (endpoint.path.equals(path) || endpoint.aliases.contains(path)) {
					return Optional.of(endpoint);
				}
			}
			return Optional.empty();
		}

	}

	/**
	 * Resolves a request path.
	 * @param path the path within the server context
	 * @param defaultProject the project addressed by unprefixed paths
	 * @return the route, or empty if the path addresses nothing
	 */
	public static Optional<EdgeRoute> parse(String path, String defaultProject) {
		if (path == null || path.isEmpty()) {
			return Optional.empty();
		}
		String trimmed = path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
		if (!trimmed.startsWith(PROJECTS_PREFIX)) {
			return Endpoint.fromPath(trimmed).map(endpoint -> new EdgeRoute(defaultProject, endpoint));
		}
		String rest = trimmed.substring(PROJECTS_PREFIX.length());
		int slash = rest.indexOf('/');
		if (slash <= 0) {
			return Optional.empty();
		}
		String project = rest.substring(0, slash);
		return Endpoint.fromPath(rest.substring(slash)).map(endpoint -> new EdgeRoute(project, endpoint));
	}

}

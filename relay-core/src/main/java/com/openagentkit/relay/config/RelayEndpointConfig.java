/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.config;

import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import com.openagentkit.relay.util.Assert;

/**
 * Where the relay lives and how to authenticate to it, as produced by provisioning.
 *
 * <p>
 * Provisioning writes a properties file with the keys {@value #KEY_URL},
 * {@value #KEY_RELAY_TOKEN} and {@value #KEY_AGENT_TOKEN}; the daemon and the edge read it
 * at startup.
 * </p>
 *
 * @param baseUrl the reachable base URL of the edge
 * @param credentials the project's credential pair
 *
 * @author Oak Relay Contributors
 */
public record RelayEndpointConfig(URI baseUrl, RelayCredentials credentials) {

	public static final String KEY_URL = "relay.url";

	public static final String KEY_RELAY_TOKEN = "relay.token";

	public static final String KEY_AGENT_TOKEN = "agent.token";

	/** Path of the daemon WebSocket endpoint below the base URL. */
	public static final String WS_ENDPOINT_PATH = "/ws";

	public RelayEndpointConfig {
		Assert.notNull(baseUrl, "Base URL must not be null");
		Assert.notNull(credentials, "Credentials must not be null");
	}

	/**
	 * Reads the configuration from provisioning properties.
	 * @param properties the properties
	 * @return the configuration
	 * @throws IllegalArgumentException if a key is missing or the URL is invalid
	 */
	public static RelayEndpointConfig fromProperties(Properties properties) {
		Assert.notNull(properties, "Properties must not be null");
		String url = properties.getProperty(KEY_URL);
		Assert.hasText(url, "Missing " + KEY_URL);
		return new RelayEndpointConfig(URI.create(url.trim()), new RelayCredentials(
				properties.getProperty(KEY_RELAY_TOKEN), properties.getProperty(KEY_AGENT_TOKEN)));
	}

	/**
	 * Loads the configuration from a provisioning properties file.
	 * @param file the properties file
	 * @return the configuration
	 * @throws IOException if the file cannot be read
	 */
	public static RelayEndpointConfig load(Path file) throws IOException {
		Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			properties.load(reader);
		}
		return fromProperties(properties);
	}

	/**
	 * Derives the WebSocket URI the daemon connects to: {@code https} becomes {@code wss},
	 * {@code http} becomes {@code ws}, a URL without a scheme is treated as {@code wss},
	 * and {@value #WS_ENDPOINT_PATH} is appended unless already present.
	 * @return the WebSocket URI
	 */
	public URI relayUri() {
		return toRelayUri(this.baseUrl.toString());
	}

	static URI toRelayUri(String url) {
		String result = url.trim();
		if (result.startsWith("https://")) {
			result = "wss://" + result.substring("https://".length());
		}
		else if (result.startsWith("http://")) {
			result = "ws://" + result.substring("http://".length());
		}
		else if (!result.startsWith("ws://") && !result.startsWith("wss://")) {
			result = "wss://" + result;
		}
		if (!result.endsWith(WS_ENDPOINT_PATH)) {
			while (result.endsWith("/")) {
				result = result.substring(0, result.length() - 1);
			}
			result = result + WS_ENDPOINT_PATH;
		}
		return URI.create(result);
	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.config;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

import com.openagentkit.relay.util.Assert;

/**
 * The credential pair of one project.
 *
 * <p>
 * The {@code relayToken} authenticates the local daemon's outbound connection to the
 * edge; the {@code agentToken} authenticates cloud agents calling the edge over HTTP. Both
 * are opaque, carry no claims, and are only ever compared in constant time.
 * </p>
 *
 * @param relayToken token presented by the daemon during the WebSocket handshake
 * @param agentToken token presented by agents in the {@code Authorization} header
 *
 * @author Oak Relay Contributors
 */
public record RelayCredentials(String relayToken, String agentToken) {

	/** Random bytes per generated token (256 bits). */
	public static final int TOKEN_BYTES = 32;

	private static final SecureRandom RANDOM = new SecureRandom();

	public RelayCredentials {
		Assert.hasText(relayToken, "Relay token must not be empty");
		Assert.hasText(agentToken, "Agent token must not be empty");
	}

	/**
	 * Generates a fresh credential pair. Tokens are URL-safe base64 without padding, so
	 * they are valid as a WebSocket sub-protocol value.
	 * @return new credentials
	 */
	public static RelayCredentials generate() {
		return new RelayCredentials(randomToken(), randomToken());
	}

	private static String randomToken() {
		byte[] bytes = new byte[TOKEN_BYTES];
		RANDOM.nextBytes(bytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
	}

	public boolean matchesRelayToken(String presented) {
		return constantTimeEquals(this.relayToken, presented);
	}

	public boolean matchesAgentToken(String presented) {
		return constantTimeEquals(this.agentToken, presented);
	}

	/**
	 * Compares two tokens without short-circuiting on the first differing byte.
	 * @param expected the expected token
	 * @param presented the presented token, may be {@code null}
	 * @return true if both are non-null and equal
	 */
	public static boolean constantTimeEquals(String expected, String presented) {
		if (expected == null || presented == null) {
			return false;
		}
		return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
				presented.getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public String toString() {
		return "RelayCredentials{relayToken=****, agentToken=****}";
	}

}

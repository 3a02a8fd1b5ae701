/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RelayCredentials}.
 *
 * @author Oak Relay Contributors
 */
class RelayCredentialsTest {

	@Test
	void generatedTokensAreDistinctAndUrlSafe() {
		RelayCredentials credentials = RelayCredentials.generate();

		assertThat(credentials.relayToken()).isNotEqualTo(credentials.agentToken());
		assertThat(credentials.relayToken()).matches("[A-Za-z0-9_-]{43}");
		assertThat(credentials.agentToken()).matches("[A-Za-z0-9_-]{43}");
		assertThat(RelayCredentials.generate().relayToken()).isNotEqualTo(credentials.relayToken());
	}

	@Test
	void matchesOnlyTheRightToken() {
		RelayCredentials credentials = new RelayCredentials("relay-secret", "agent-secret");

		assertThat(credentials.matchesRelayToken("relay-secret")).isTrue();
		assertThat(credentials.matchesRelayToken("agent-secret")).isFalse();
		assertThat(credentials.matchesAgentToken("agent-secret")).isTrue();
		assertThat(credentials.matchesAgentToken("agent-secre")).isFalse();
		assertThat(credentials.matchesAgentToken(null)).isFalse();
	}

	@Test
	void rejectsBlankTokens() {
		assertThatThrownBy(() -> new RelayCredentials("", "agent")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new RelayCredentials("relay", null)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void toStringHidesTokens() {
		RelayCredentials credentials = new RelayCredentials("relay-secret", "agent-secret");

		assertThat(credentials.toString()).doesNotContain("relay-secret").doesNotContain("agent-secret");
	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.openagentkit.relay.config.RelayCredentials;
import com.openagentkit.relay.util.Assert;

/**
 * {@link CredentialStore} backed by a concurrent map.
 *
 * @author Oak Relay Contributors
 */
public class InMemoryCredentialStore implements CredentialStore {

	private final Map<String, RelayCredentials> credentials = new ConcurrentHashMap<>();

	public static InMemoryCredentialStore of(String project, RelayCredentials credentials) {
		InMemoryCredentialStore store = new InMemoryCredentialStore();
		store.put(project, credentials);
		return store;
	}

	@Override
	public Optional<RelayCredentials> find(String project) {
		if (project == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(this.credentials.get(project));
	}

	@Override
	public void put(String project, RelayCredentials credentials) {
		Assert.hasText(project, "Project must not be empty");
		Assert.notNull(credentials, "Credentials must not be null");
		this.credentials.put(project, credentials);
	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import java.util.Optional;

import com.openagentkit.relay.config.RelayCredentials;

/**
 * Source of the credential pair provisioned for each project hosted by the edge.
 *
 * @author Oak Relay Contributors
 */
public interface CredentialStore {

	/**
	 * Looks up a project's credentials.
	 * @param project the project id
	 * @return the credentials, or empty if the project is not hosted here
	 */
	Optional<RelayCredentials> find(String project);

	/**
	 * Installs or replaces a project's credentials.
	 * @param project the project id
	 * @param credentials the new credential pair
	 */
	void put(String project, RelayCredentials credentials);

}

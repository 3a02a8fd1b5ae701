/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.error;

import com.openagentkit.relay.spec.RelaySchema;

/**
 * Exception raised by relay components. Carries a machine-readable kind from
 * {@link RelayErrorKinds} so that it can travel as an {@code error} frame or be rendered
 * as an HTTP status with a {@code reason}.
 *
 * @author Oak Relay Contributors
 */
public class RelayException extends RuntimeException {

	private final String kind;

	/**
	 * Creates a relay exception.
	 * @param kind the error kind
	 * @param message the error message
	 */
	public RelayException(String kind, String message) {
		super(message);
		this.kind = kind;
	}

	/**
	 * Creates a relay exception with a cause.
	 * @param kind the error kind
	 * @param message the error message
	 * @param cause the underlying cause
	 */
	public RelayException(String kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	/**
	 * Creates a relay exception from an {@code error} frame received over the wire.
	 * @param frame the error frame
	 */
	public RelayException(RelaySchema.ErrorFrame frame) {
		this(frame.kind(), frame.message());
	}

	public String getKind() {
		return this.kind;
	}

	/**
	 * Converts this exception to an {@code error} frame answering the given call.
	 * @param id the call id, or {@code null} for a connection-level error
	 * @return the error frame
	 */
	public RelaySchema.ErrorFrame toErrorFrame(String id) {
		return new RelaySchema.ErrorFrame(id, this.kind, getMessage());
	}

	public static RelayException offline(String project) {
		return new RelayException(RelayErrorKinds.OFFLINE, "No instance connected for project " + project);
	}

	public static RelayException superseded(long generation) {
		return new RelayException(RelayErrorKinds.SUPERSEDED,
				"Session generation " + generation + " was replaced by a newer connection");
	}

	public static RelayException connectionLost(long generation) {
		return new RelayException(RelayErrorKinds.CONNECTION_LOST,
				"Connection for session generation " + generation + " was closed");
	}

	public static RelayException timeout(String id) {
		return new RelayException(RelayErrorKinds.TIMEOUT, "No response for call " + id + " within deadline");
	}

	public static RelayException unknownMethod(String method) {
		return new RelayException(RelayErrorKinds.UNKNOWN_METHOD, "Unknown method: " + method);
	}

	@Override
	public String toString() {
		return "RelayException{kind='" + kind + "', message='" + getMessage() + "'}";
	}

}

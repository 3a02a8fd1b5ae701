/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.config;

import java.time.Duration;

import com.openagentkit.relay.util.Assert;

/**
 * The time constants governing relay liveness.
 *
 * <p>
 * A connection is considered dead once no traffic has been seen for
 * {@code heartbeatInterval * missThreshold}. The request timeout must exceed that window,
 * otherwise an in-flight call could be reported as timed out while the connection is
 * still considered alive.
 * </p>
 *
 * @param heartbeatInterval interval between daemon heartbeats
 * @param missThreshold number of intervals without traffic before a connection is dead
 * @param requestTimeout how long the edge waits for a relayed call to be answered
 * @param handshakeTimeout how long the daemon waits for the edge to acknowledge
 * registration
 *
 * @author Oak Relay Contributors
 */
public record RelayTimings(Duration heartbeatInterval, int missThreshold, Duration requestTimeout,
		Duration handshakeTimeout) {

	public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(8);

	public static final int DEFAULT_MISS_THRESHOLD = 3;

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(10);

	public RelayTimings {
		Assert.notNull(heartbeatInterval, "Heartbeat interval must not be null");
		Assert.notNull(requestTimeout, "Request timeout must not be null");
		Assert.notNull(handshakeTimeout, "Handshake timeout must not be null");
		Assert.isTrue(!heartbeatInterval.isNegative() && !heartbeatInterval.isZero(),
				"Heartbeat interval must be positive");
		Assert.isTrue(missThreshold > 0, "Miss threshold must be positive");
		Assert.isTrue(!handshakeTimeout.isNegative() && !handshakeTimeout.isZero(),
				"Handshake timeout must be positive");
		Assert.isTrue(requestTimeout.compareTo(heartbeatInterval.multipliedBy(missThreshold)) > 0,
				"Request timeout must exceed heartbeat interval * miss threshold");
	}

	public static RelayTimings defaults() {
		return new RelayTimings(DEFAULT_HEARTBEAT_INTERVAL, DEFAULT_MISS_THRESHOLD, DEFAULT_REQUEST_TIMEOUT,
				DEFAULT_HANDSHAKE_TIMEOUT);
	}

	/**
	 * Time without inbound traffic after which a connection is treated as dead.
	 * @return heartbeat interval multiplied by the miss threshold
	 */
	public Duration livenessWindow() {
		return this.heartbeatInterval.multipliedBy(this.missThreshold);
	}

	public RelayTimings withHeartbeat(Duration heartbeatInterval, int missThreshold) {
		return new RelayTimings(heartbeatInterval, missThreshold, this.requestTimeout, this.handshakeTimeout);
	}

	public RelayTimings withRequestTimeout(Duration requestTimeout) {
		return new RelayTimings(this.heartbeatInterval, this.missThreshold, requestTimeout, this.handshakeTimeout);
	}

	public RelayTimings withHandshakeTimeout(Duration handshakeTimeout) {
		return new RelayTimings(this.heartbeatInterval, this.missThreshold, this.requestTimeout, handshakeTimeout);
	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.daemon;

import java.time.Duration;

import com.openagentkit.relay.util.Assert;

/**
 * Exponential reconnect backoff: the n-th consecutive failed attempt waits
 * {@code min(max, base * 2^(n-1))}. With the defaults that is 1s, 2s, 4s, ... capped at
 * 60s. {@link #reset()} after a successful connection starts over at the base delay.
 *
 * <p>
 * Not thread-safe; owned by the connection loop.
 * </p>
 *
 * @author Oak Relay Contributors
 */
public class ReconnectBackoff {

	public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

	public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

	private final Duration baseDelay;

	private final Duration maxDelay;

	private int failures;

	public ReconnectBackoff() {
		this(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
	}

	public ReconnectBackoff(Duration baseDelay, Duration maxDelay) {
		Assert.notNull(baseDelay, "Base delay must not be null");
		Assert.notNull(maxDelay, "Max delay must not be null");
		Assert.isTrue(!baseDelay.isNegative() && !baseDelay.isZero(), "Base delay must be positive");
		Assert.isTrue(maxDelay.compareTo(baseDelay) >= 0, "Max delay must not be less than base delay");
		this.baseDelay = baseDelay;
		this.maxDelay = maxDelay;
	}

	/**
	 * Records a failed attempt and returns how long to wait before the next one.
	 * @return the delay for this failure
	 */
	public Duration nextDelay() {
		this.failures++;
		return delayForAttempt(this.failures);
	}

	/**
	 * Delay after the given number of consecutive failures.
	 * @param attempt consecutive failures so far, starting at 1
	 * @return the delay
	 */
	public Duration delayForAttempt(int attempt) {
		Assert.isTrue(attempt > 0, "Attempt must be positive");
		// shift capped so the long cannot overflow
		int shift = Math.min(attempt - 1, 30);
		long millis = this.baseDelay.toMillis() << shift;
		if (millis <= 0 || millis > this.maxDelay.toMillis()) {
			return this.maxDelay;
		}
		return Duration.ofMillis(millis);
	}

	public void reset() {
		this.failures = 0;
	}

	public int failures() {
		return this.failures;
	}

}

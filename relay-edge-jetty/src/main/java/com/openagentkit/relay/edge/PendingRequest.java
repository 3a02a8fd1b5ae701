/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import java.util.concurrent.atomic.AtomicBoolean;

import com.openagentkit.relay.spec.RelaySchema.RelayFrame;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Correlation record for one relayed call awaiting its answer. A pending request is
 * settled exactly once: by the daemon's answer, by its deadline, or by the end of the
 * session that owns it.
 *
 * @author Oak Relay Contributors
 */
final class PendingRequest {

	private final String id;

	private final long generation;

	private final Sinks.One<RelayFrame> result = Sinks.one();

	private final AtomicBoolean settled = new AtomicBoolean(false);

	private volatile Disposable deadline;

	PendingRequest(String id, long generation) {
		this.id = id;
		this.generation = generation;
	}

	String id() {
		return this.id;
	}

	long generation() {
		return this.generation;
	}

	Mono<RelayFrame> result() {
		return this.result.asMono();
	}

	void deadline(Disposable deadline) {
		this.deadline = deadline;
		if (this.settled.get()) {
			deadline.dispose();
		}
	}

	/**
	 * Fulfils the request with the daemon's answer.
	 * @param frame a response or error frame
	 * @return {@code false} if the request was already settled
	 */
	boolean complete(RelayFrame frame) {
		if (!this.settled.compareAndSet(false, true)) {
			return false;
		}
		cancelDeadline();
		this.result.tryEmitValue(frame);
		return true;
	}

	boolean fail(Throwable error) {
		if (!this.settled.compareAndSet(false, true)) {
			return false;
		}
		cancelDeadline();
		this.result.tryEmitError(error);
		return true;
	}

	boolean isSettled() {
		return this.settled.get();
	}

	private void cancelDeadline() {
		Disposable task = this.deadline;
		if (task != null) {
			task.dispose();
		}
	}

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.edge;

import com.openagentkit.relay.spec.RelaySchema.RelayFrame;
import reactor.core.publisher.Mono;

/**
 * The edge's end of one daemon connection. Frames written through a channel are sent
 * one at a time, in the order {@link #send} was called.
 *
 * @author Oak Relay Contributors
 */
public interface RelaySessionChannel {

	/** Normal closure. */
	int CLOSE_NORMAL = 1000;

	/** The edge is shutting down. */
	int CLOSE_GOING_AWAY = 1001;

	/** The daemon sent something the edge does not accept. */
	int CLOSE_PROTOCOL_ERROR = 1008;

	/** A newer connection registered for the same project. */
	int CLOSE_SUPERSEDED = 4000;

	/** The project's credentials were replaced. */
	int CLOSE_CREDENTIALS_ROTATED = 4001;

	/** No traffic from the daemon within the liveness window. */
	int CLOSE_HEARTBEAT_TIMEOUT = 4002;

	/**
	 * Queues a frame for sending.
	 * @param frame the frame
	 * @return a {@link Mono} completing once the frame is written, or erroring if the
	 * channel is closed or the write failed
	 */
	Mono<Void> send(RelayFrame frame);

	/**
	 * Closes the underlying connection. Closing twice is harmless.
	 * @param code WebSocket close code
	 * @param reason close reason
	 */
	void close(int code, String reason);

	boolean isOpen();

}

/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.daemon;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import com.openagentkit.relay.error.RelayErrorKinds;
import com.openagentkit.relay.error.RelayException;
import com.openagentkit.relay.spec.RelaySchema;
import com.openagentkit.relay.spec.RelaySchema.CallFrame;
import com.openagentkit.relay.spec.RelaySchema.ErrorFrame;
import com.openagentkit.relay.spec.RelaySchema.RelayFrame;
import com.openagentkit.relay.spec.RelaySchema.ResponseFrame;
import com.openagentkit.relay.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Turns relayed {@code call} frames into exactly one {@code response} or {@code error}
 * frame each, by invoking the local {@link ToolExecutionService}.
 *
 * <p>
 * Calls are independent: each dispatch runs on its own worker from the dispatch scheduler
 * and carries the id it was called with. Tool failures never escape as errors from
 * {@link #dispatch(CallFrame)}; they become {@code error} frames.
 * </p>
 *
 * @author Oak Relay Contributors
 */
public class LocalDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(LocalDispatcher.class);

	/** Default cap on the serialized size of a response frame. */
	public static final int DEFAULT_MAX_RESPONSE_BYTES = 1024 * 1024;

	private final ToolExecutionService toolService;

	private final McpJsonMapper jsonMapper;

	private final int maxResponseBytes;

	private final Scheduler scheduler;

	public LocalDispatcher(ToolExecutionService toolService, McpJsonMapper jsonMapper) {
		this(toolService, jsonMapper, DEFAULT_MAX_RESPONSE_BYTES, Schedulers.boundedElastic());
	}

	/**
	 * Creates a dispatcher.
	 * @param toolService the tool execution service
	 * @param jsonMapper mapper used to measure response size
	 * @param maxResponseBytes largest serialized response frame relayed as-is
	 * @param scheduler scheduler tool executions are subscribed on; tools may block
	 */
	public LocalDispatcher(ToolExecutionService toolService, McpJsonMapper jsonMapper, int maxResponseBytes,
			Scheduler scheduler) {
		Assert.notNull(toolService, "Tool execution service must not be null");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.isTrue(maxResponseBytes > 0, "Max response bytes must be positive");
		Assert.notNull(scheduler, "Scheduler must not be null");
		this.toolService = toolService;
		this.jsonMapper = jsonMapper;
		this.maxResponseBytes = maxResponseBytes;
		this.scheduler = scheduler;
	}

	/**
	 * Executes the called tool and produces the frame answering the call.
	 * @param call the call frame
	 * @return a Mono emitting exactly one response or error frame tagged with the call id
	 */
	public Mono<RelayFrame> dispatch(CallFrame call) {
		Assert.notNull(call, "Call must not be null");
		logger.debug("Dispatching call {} to tool {}", call.id(), call.method());

		Mono<Object> execution = Mono.defer(() -> this.toolService.execute(call.method(), call.params()))
			.subscribeOn(this.scheduler);
		if (call.timeoutMs() != null && call.timeoutMs() > 0) {
			execution = execution.timeout(Duration.ofMillis(call.timeoutMs()));
		}

		return execution.map(result -> toResponse(call, result))
			.switchIfEmpty(Mono.fromSupplier(() -> toResponse(call, null)))
			.onErrorResume(error -> Mono.just(toError(call, error)));
	}

	private RelayFrame toResponse(CallFrame call, Object result) {
		ResponseFrame response = new ResponseFrame(call.id(), result);
		int size;
		try {
			size = RelaySchema.serializeFrame(this.jsonMapper, response).getBytes(StandardCharsets.UTF_8).length;
		}
		catch (Exception e) {
			logger.warn("Result of tool {} for call {} is not serializable: {}", call.method(), call.id(),
					e.getMessage());
			return new ErrorFrame(call.id(), RelayErrorKinds.TOOL_EXECUTION_FAILED, "Tool result is not serializable");
		}
		if (size > this.maxResponseBytes) {
			logger.warn("Result of tool {} for call {} is {} bytes, over the {} byte limit", call.method(), call.id(),
					size, this.maxResponseBytes);
			return new ErrorFrame(call.id(), RelayErrorKinds.RESPONSE_TOO_LARGE,
					"Response too large (" + size + " bytes, max " + this.maxResponseBytes + ")");
		}
		return response;
	}

	private ErrorFrame toError(CallFrame call, Throwable error) {
		if (error instanceof RelayException relayException) {
			logger.warn("Call {} to {} rejected: {}", call.id(), call.method(), relayException.getMessage());
			return relayException.toErrorFrame(call.id());
		}
		if (error instanceof TimeoutException) {
			logger.warn("Tool {} timed out for call {} after {} ms", call.method(), call.id(), call.timeoutMs());
			return new ErrorFrame(call.id(), RelayErrorKinds.TOOL_EXECUTION_FAILED,
					"Tool timed out after " + call.timeoutMs() + " ms");
		}
		String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
		logger.warn("Tool {} failed for call {}: {}", call.method(), call.id(), message);
		logger.debug("Tool failure detail for call {}", call.id(), error);
		return new ErrorFrame(call.id(), RelayErrorKinds.TOOL_EXECUTION_FAILED, message);
	}

}

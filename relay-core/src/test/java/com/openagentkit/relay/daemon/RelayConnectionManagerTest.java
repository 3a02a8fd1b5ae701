/*
 * Copyright 2025-2026 the original author or authors.
 */

package com.openagentkit.relay.daemon;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import com.openagentkit.relay.config.RelayCredentials;
import com.openagentkit.relay.config.RelayEndpointConfig;
import com.openagentkit.relay.error.RelayErrorKinds;
import com.openagentkit.relay.error.RelayException;
import com.openagentkit.relay.spec.RelaySchema.CallFrame;
import com.openagentkit.relay.spec.RelaySchema.ErrorFrame;
import com.openagentkit.relay.spec.RelaySchema.HeartbeatFrame;
import com.openagentkit.relay.spec.RelaySchema.RegisterFrame;
import com.openagentkit.relay.spec.RelaySchema.ResponseFrame;
import com.openagentkit.relay.spec.RelaySchema.ToolDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RelayConnectionManager} driven by a virtual-time connection loop and
 * mock transports.
 *
 * @author Oak Relay Contributors
 */
class RelayConnectionManagerTest {

	private static final URI RELAY_URI = URI.create("ws://localhost:8787/ws");

	private static final String RELAY_TOKEN = "relay-token";

	private VirtualTimeScheduler loop;

	private final Deque<MockRelayClientTransport> scripted = new ArrayDeque<>();

	private final List<MockRelayClientTransport> created = new CopyOnWriteArrayList<>();

	private final List<Long> attemptTimes = new CopyOnWriteArrayList<>();

	private long nextGeneration = 1;

	private RelayConnectionManager manager;

	@BeforeEach
	void setUp() {
		this.loop = VirtualTimeScheduler.create();
	}

	@AfterEach
	void tearDown() {
		if (this.manager != null) {
			this.manager.closeGracefully().block(Duration.ofSeconds(5));
		}
		this.loop.dispose();
	}

	private RelayConnectionManager.Builder builder(ToolExecutionService tools) {
		return RelayConnectionManager.builder(RELAY_URI, RELAY_TOKEN)
			.toolService(tools)
			.connectionLoop(this.loop)
			.dispatchScheduler(Schedulers.immediate())
			.transportFactory((uri, token) -> {
				assertThat(uri).isEqualTo(RELAY_URI);
				assertThat(token).isEqualTo(RELAY_TOKEN);
				this.attemptTimes.add(this.loop.now(TimeUnit.MILLISECONDS));
				MockRelayClientTransport transport = this.scripted.isEmpty()
						? MockRelayClientTransport.accepting(this.nextGeneration++) : this.scripted.poll();
				this.created.add(transport);
				return transport;
			});
	}

	private RelayConnectionManager echoManager() {
		this.manager = builder((method, params) -> Mono.just(params.get("q"))).build();
		return this.manager;
	}

	@Test
	void connectRegistersAndBecomesConnected() {
		this.manager = builder(new ToolExecutionService() {
			@Override
			public Mono<Object> execute(String method, Map<String, Object> params) {
				return Mono.empty();
			}

			@Override
			public Mono<List<ToolDescriptor>> listTools() {
				return Mono.just(List.of(new ToolDescriptor("oak_search")));
			}
		}).build();

		RelayStatus status = this.manager.connect().block(Duration.ofSeconds(5));

		assertThat(status.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(status.connected()).isTrue();
		assertThat(status.generation()).isEqualTo(1);
		assertThat(status.relayUri()).isEqualTo(RELAY_URI);
		List<RegisterFrame> registrations = this.created.get(0).getSentFrames(RegisterFrame.class);
		assertThat(registrations).hasSize(1);
		assertThat(registrations.get(0).tools()).extracting(ToolDescriptor::name).containsExactly("oak_search");
	}

	@Test
	void toolCatalogThrowingSynchronouslyStillRegisters() {
		this.manager = builder(new ToolExecutionService() {
			@Override
			public Mono<Object> execute(String method, Map<String, Object> params) {
				return Mono.empty();
			}

			@Override
			public Mono<List<ToolDescriptor>> listTools() {
				throw new IllegalStateException("catalog not loaded");
			}
		}).build();

		RelayStatus status = this.manager.connect().block(Duration.ofSeconds(5));

		assertThat(status.state()).isEqualTo(ConnectionState.CONNECTED);
		List<RegisterFrame> registrations = this.created.get(0).getSentFrames(RegisterFrame.class);
		assertThat(registrations).hasSize(1);
		assertThat(registrations.get(0).tools()).isEmpty();
	}

	@Test
	void stateChangesAreObservable() {
		echoManager();
		List<ConnectionState> states = new CopyOnWriteArrayList<>();
		this.manager.stateChanges().subscribe(states::add);

		this.manager.connect().block(Duration.ofSeconds(5));

		assertThat(states).containsExactly(ConnectionState.DISCONNECTED, ConnectionState.CONNECTING,
				ConnectionState.AUTHENTICATING, ConnectionState.CONNECTED);
	}

	@Test
	void connectWhileConnectedDoesNotStartSecondHandshake() {
		echoManager();
		this.manager.connect().block(Duration.ofSeconds(5));

		RelayStatus again = this.manager.connect().block(Duration.ofSeconds(5));

		assertThat(again.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(this.created).hasSize(1);
	}

	@Test
	void callsAreDispatchedAndAnsweredWithSameId() {
		echoManager();
		this.manager.connect().block(Duration.ofSeconds(5));
		MockRelayClientTransport transport = this.created.get(0);

		transport.simulateIncomingFrame(new CallFrame("c-1", "echo", Map.of("q", "hello")));
		transport.simulateIncomingFrame(new CallFrame("c-2", "echo", Map.of("q", "world")));

		assertThat(transport.getSentFrames(ResponseFrame.class)).containsExactly(new ResponseFrame("c-1", "hello"),
				new ResponseFrame("c-2", "world"));
	}

	@Test
	void failingToolIsAnsweredWithErrorFrame() {
		this.manager = builder((method, params) -> Mono.error(new IllegalStateException("index locked"))).build();
		this.manager.connect().block(Duration.ofSeconds(5));
		MockRelayClientTransport transport = this.created.get(0);

		transport.simulateIncomingFrame(new CallFrame("c-1", "oak_search", Map.of()));

		assertThat(transport.getSentFrames(ErrorFrame.class))
			.containsExactly(new ErrorFrame("c-1", RelayErrorKinds.TOOL_EXECUTION_FAILED, "index locked"));
		assertThat(this.manager.state()).isEqualTo(ConnectionState.CONNECTED);
	}

	@Test
	void sendsHeartbeatsOnInterval() {
		echoManager();
		this.manager.connect().block(Duration.ofSeconds(5));
		MockRelayClientTransport transport = this.created.get(0);

		for (int i = 0; i < 5; i++) {
			this.loop.advanceTimeBy(Duration.ofSeconds(8));
			transport.simulateIncomingFrame(new HeartbeatFrame());
		}

		assertThat(transport.getSentFrames(HeartbeatFrame.class)).hasSize(5)
			.allSatisfy(heartbeat -> assertThat(heartbeat.timestamp()).isNotNull());
		assertThat(this.manager.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(this.created).hasSize(1);
	}

	@Test
	void silentEdgeForcesReconnect() {
		echoManager();
		this.manager.connect().block(Duration.ofSeconds(5));

		this.loop.advanceTimeBy(Duration.ofSeconds(24));
		assertThat(this.manager.state()).isEqualTo(ConnectionState.CONNECTED);

		this.loop.advanceTimeBy(Duration.ofSeconds(8));
		assertThat(this.manager.state()).isEqualTo(ConnectionState.RECONNECTING);
		assertThat(this.created.get(0).isClosed()).isTrue();
		assertThat(this.manager.status().error()).isEqualTo("Heartbeat timeout");

		this.loop.advanceTimeBy(Duration.ofSeconds(1));
		assertThat(this.manager.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(this.manager.status().generation()).isEqualTo(2);
	}

	@Test
	void backoffDoublesUpToSixtySeconds() {
		this.manager = builder((method, params) -> Mono.empty())
			.transportFactory((uri, token) -> {
				this.attemptTimes.add(this.loop.now(TimeUnit.MILLISECONDS));
				return MockRelayClientTransport
					.failing(new RelayException(RelayErrorKinds.UNAUTHORIZED, "Relay rejected the handshake (HTTP 401)"));
			})
			.build();

		RelayStatus first = this.manager.connect().block(Duration.ofSeconds(5));
		assertThat(first.state()).isEqualTo(ConnectionState.RECONNECTING);
		assertThat(first.reconnectAttempts()).isEqualTo(1);

		this.loop.advanceTimeBy(Duration.ofSeconds(200));

		List<Long> gaps = new ArrayList<>();
		for (int i = 1; i < this.attemptTimes.size(); i++) {
			gaps.add((this.attemptTimes.get(i) - this.attemptTimes.get(i - 1)) / 1000);
		}
		assertThat(gaps).containsExactly(1L, 2L, 4L, 8L, 16L, 32L, 60L, 60L);
		assertThat(this.manager.status().reconnectAttempts()).isEqualTo(9);
		assertThat(this.manager.status().error()).contains("HTTP 401");
	}

	@Test
	void backoffResetsAfterSuccessfulReconnect() {
		RelayException refused = new RelayException(RelayErrorKinds.CONNECTION_LOST, "Connection refused");
		this.scripted.add(MockRelayClientTransport.failing(refused));
		this.scripted.add(MockRelayClientTransport.failing(refused));
		this.scripted.add(MockRelayClientTransport.accepting(5));
		echoManager();

		this.manager.connect().block(Duration.ofSeconds(5));
		this.loop.advanceTimeBy(Duration.ofSeconds(3));
		assertThat(this.manager.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(this.manager.status().reconnectAttempts()).isZero();

		this.created.get(2).simulateDrop();
		assertThat(this.manager.state()).isEqualTo(ConnectionState.RECONNECTING);
		this.loop.advanceTimeBy(Duration.ofSeconds(1));

		assertThat(this.manager.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(this.attemptTimes).containsExactly(0L, 1000L, 3000L, 4000L);
	}

	@Test
	void handshakeTimesOutWithoutRegistration() {
		this.scripted.add(MockRelayClientTransport.silent());
		echoManager();

		StepVerifier.create(this.manager.connect())
			.then(() -> assertThat(this.manager.state()).isEqualTo(ConnectionState.AUTHENTICATING))
			.then(() -> this.loop.advanceTimeBy(Duration.ofSeconds(10)))
			.assertNext(status -> assertThat(status.state()).isEqualTo(ConnectionState.RECONNECTING))
			.verifyComplete();
		assertThat(this.created.get(0).isClosed()).isTrue();
	}

	@Test
	void edgeErrorDuringRegistrationFailsAttempt() {
		this.scripted.add(MockRelayClientTransport.silent());
		echoManager();

		StepVerifier.create(this.manager.connect())
			.then(() -> this.created.get(0)
				.simulateIncomingFrame(new ErrorFrame(null, RelayErrorKinds.UNAUTHORIZED, "Relay token rejected")))
			.assertNext(status -> {
				assertThat(status.state()).isEqualTo(ConnectionState.RECONNECTING);
				assertThat(status.error()).isEqualTo("Relay token rejected");
			})
			.verifyComplete();
	}

	@Test
	void disconnectStopsReconnecting() {
		echoManager();
		this.manager.connect().block(Duration.ofSeconds(5));
		MockRelayClientTransport transport = this.created.get(0);

		this.manager.disconnect().block(Duration.ofSeconds(5));
		transport.simulateDrop();
		this.loop.advanceTimeBy(Duration.ofMinutes(5));

		assertThat(this.manager.state()).isEqualTo(ConnectionState.DISCONNECTED);
		assertThat(transport.isClosed()).isTrue();
		assertThat(this.created).hasSize(1);
		assertThat(this.manager.status().connected()).isFalse();
	}

	@Test
	void disconnectCancelsPendingReconnect() {
		this.scripted.add(MockRelayClientTransport.failing(new IllegalStateException("edge unreachable")));
		echoManager();
		this.manager.connect().block(Duration.ofSeconds(5));
		assertThat(this.manager.state()).isEqualTo(ConnectionState.RECONNECTING);

		this.manager.disconnect().block(Duration.ofSeconds(5));
		this.loop.advanceTimeBy(Duration.ofMinutes(5));

		assertThat(this.manager.state()).isEqualTo(ConnectionState.DISCONNECTED);
		assertThat(this.created).hasSize(1);
	}

	@Test
	void connectAfterDisconnectStartsAgain() {
		echoManager();
		this.manager.connect().block(Duration.ofSeconds(5));
		this.manager.disconnect().block(Duration.ofSeconds(5));

		RelayStatus status = this.manager.connect().block(Duration.ofSeconds(5));

		assertThat(status.state()).isEqualTo(ConnectionState.CONNECTED);
		assertThat(status.generation()).isEqualTo(2);
	}

	@Test
	void builderDerivesRelayUriFromEndpointConfig() {
		RelayEndpointConfig config = new RelayEndpointConfig(URI.create("https://relay.example.com"),
				new RelayCredentials("r", "a"));

		RelayConnectionManager fromConfig = RelayConnectionManager.builder(config)
			.toolService((method, params) -> Mono.empty())
			.connectionLoop(this.loop)
			.build();

		assertThat(fromConfig.relayUri()).isEqualTo(URI.create("wss://relay.example.com/ws"));
		assertThat(fromConfig.status().state()).isEqualTo(ConnectionState.DISCONNECTED);
	}

	@Test
	void builderRequiresToolService() {
		assertThatThrownBy(() -> RelayConnectionManager.builder(RELAY_URI, RELAY_TOKEN).build())
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> RelayConnectionManager.builder(RELAY_URI, " "))
			.isInstanceOf(IllegalArgumentException.class);
	}

}

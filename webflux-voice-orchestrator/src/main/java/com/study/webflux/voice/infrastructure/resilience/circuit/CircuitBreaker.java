package com.study.webflux.voice.infrastructure.resilience.circuit;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import reactor.core.publisher.Mono;

/**
 * 다운스트림 서비스별 서킷 브레이커
 *
 * <p>
 * 서비스 이름 단위로 생성되어 모든 파이프라인이 공유합니다. 상태와 실패 이력, 카운터는 {@code stateLock}으로 보호됩니다.
 *
 * <h3>요청 처리</h3>
 * <ul>
 * <li>OPEN이고 재시도 시각 전: 거부 카운트 증가 후 fallback 실행 또는 {@link CircuitBreakerOpenException}</li>
 * <li>OPEN이고 타임아웃 경과: HALF_OPEN 전이 후 시험 요청 실행</li>
 * <li>그 외: 요청 실행 후 결과를 기록</li>
 * </ul>
 *
 * <h3>결과 기록</h3>
 * <ul>
 * <li>성공: HALF_OPEN에서 성공 횟수가 successThreshold에 도달하면 CLOSED 전이, 실패 이력 초기화</li>
 * <li>실패: 롤링 윈도우 밖 실패 제거. HALF_OPEN이면 즉시 OPEN, CLOSED에서 실패 수가 failureThreshold에 도달하면 OPEN</li>
 * </ul>
 */
@Slf4j
public class CircuitBreaker {
	private final String name;
	private final CircuitBreakerConfig config;
	private final Clock clock;
	private final Object stateLock = new Object();

	private volatile CircuitBreakerState state = CircuitBreakerState.CLOSED;
	private final Deque<Instant> failureTimestamps = new ArrayDeque<>();
	private int halfOpenSuccesses;
	private Instant nextAttemptTime;

	private long totalRequests;
	private long successfulRequests;
	private long failedRequests;
	private long rejectedRequests;
	private Instant lastFailureTime;
	private Instant lastSuccessTime;

	private volatile Consumer<CircuitBreakerStateChangeEvent> stateChangeListener = event -> {
	};

	public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
		this.name = name;
		this.config = config;
		this.clock = clock;
	}

	public void setStateChangeListener(Consumer<CircuitBreakerStateChangeEvent> listener) {
		this.stateChangeListener = listener;
	}

	/**
	 * 서킷 브레이커를 거쳐 호출합니다. 실패나 거부 시 오류를 그대로 전달합니다.
	 */
	public <T> Mono<T> execute(Supplier<Mono<T>> call) {
		return execute(call, null);
	}

	/**
	 * 서킷 브레이커를 거쳐 호출합니다.
	 *
	 * @param call
	 *            보호할 호출. 구독 시점에 생성됩니다.
	 * @param fallback
	 *            거부 또는 실패 시 원인을 받아 대체 결과를 만듭니다. null이면 오류를 전파합니다.
	 */
	public <T> Mono<T> execute(Supplier<Mono<T>> call, Function<Throwable, Mono<T>> fallback) {
		return Mono.defer(() -> {
			if (!acquirePermission()) {
				CircuitBreakerOpenException rejected = new CircuitBreakerOpenException(name);
				log.warn("서킷 브레이커 {} OPEN 상태로 요청 거부", name);
				return fallback != null ? fallback.apply(rejected) : Mono.<T>error(rejected);
			}

			return Mono.defer(call)
				.doOnSuccess(result -> onSuccess())
				.onErrorResume(error -> {
					onFailure();
					log.warn("서킷 브레이커 {} 호출 실패: {}", name, error.getMessage());
					return fallback != null ? fallback.apply(error) : Mono.error(error);
				});
		});
	}

	/**
	 * 요청 허용 여부를 판단하고 필요하면 HALF_OPEN으로 전이합니다.
	 */
	private boolean acquirePermission() {
		CircuitBreakerStateChangeEvent event = null;
		synchronized (stateLock) {
			totalRequests++;
			if (state == CircuitBreakerState.OPEN) {
				Instant now = clock.instant();
				if (now.isBefore(nextAttemptTime)) {
					rejectedRequests++;
					return false;
				}
				halfOpenSuccesses = 0;
				event = changeState(CircuitBreakerState.HALF_OPEN, now);
			}
		}
		publish(event);
		return true;
	}

	void onSuccess() {
		CircuitBreakerStateChangeEvent event = null;
		synchronized (stateLock) {
			Instant now = clock.instant();
			successfulRequests++;
			lastSuccessTime = now;

			if (state == CircuitBreakerState.HALF_OPEN) {
				halfOpenSuccesses++;
				if (halfOpenSuccesses >= config.successThreshold()) {
					failureTimestamps.clear();
					halfOpenSuccesses = 0;
					event = changeState(CircuitBreakerState.CLOSED, now);
				}
			}
		}
		publish(event);
	}

	void onFailure() {
		CircuitBreakerStateChangeEvent event = null;
		synchronized (stateLock) {
			Instant now = clock.instant();
			failedRequests++;
			lastFailureTime = now;
			failureTimestamps.addLast(now);
			pruneFailures(now);

			if (state == CircuitBreakerState.HALF_OPEN) {
				event = openCircuit(now);
			} else if (state == CircuitBreakerState.CLOSED
				&& failureTimestamps.size() >= config.failureThreshold()) {
				event = openCircuit(now);
			}
		}
		publish(event);
	}

	/**
	 * OPEN 상태라도 재시도 시각이 지났으면 사용 가능으로 봅니다.
	 */
	public boolean isAvailable() {
		synchronized (stateLock) {
			if (state != CircuitBreakerState.OPEN) {
				return true;
			}
			return !clock.instant().isBefore(nextAttemptTime);
		}
	}

	/** 운영자가 강제로 서킷을 엽니다. */
	public void open() {
		CircuitBreakerStateChangeEvent event;
		synchronized (stateLock) {
			event = openCircuit(clock.instant());
		}
		publish(event);
	}

	/** 운영자가 강제로 서킷을 닫습니다. */
	public void close() {
		CircuitBreakerStateChangeEvent event;
		synchronized (stateLock) {
			failureTimestamps.clear();
			halfOpenSuccesses = 0;
			nextAttemptTime = null;
			event = changeState(CircuitBreakerState.CLOSED, clock.instant());
		}
		publish(event);
	}

	/**
	 * 상태와 누적 지표를 모두 초기화합니다.
	 */
	public void reset() {
		CircuitBreakerStateChangeEvent event;
		synchronized (stateLock) {
			failureTimestamps.clear();
			halfOpenSuccesses = 0;
			nextAttemptTime = null;
			totalRequests = 0;
			successfulRequests = 0;
			failedRequests = 0;
			rejectedRequests = 0;
			lastFailureTime = null;
			lastSuccessTime = null;
			event = changeState(CircuitBreakerState.CLOSED, clock.instant());
		}
		publish(event);
	}

	public CircuitBreakerState getState() {
		return state;
	}

	public String getName() {
		return name;
	}

	public CircuitBreakerConfig getConfig() {
		return config;
	}

	public CircuitBreakerMetrics getMetrics() {
		synchronized (stateLock) {
			pruneFailures(clock.instant());
			return new CircuitBreakerMetrics(totalRequests,
				successfulRequests,
				failedRequests,
				rejectedRequests,
				lastFailureTime,
				lastSuccessTime,
				state,
				failureTimestamps.size());
		}
	}

	public CircuitBreakerStatus getStatus() {
		return new CircuitBreakerStatus(getState(), isAvailable(), getMetrics());
	}

	private CircuitBreakerStateChangeEvent openCircuit(Instant now) {
		nextAttemptTime = now.plus(config.timeout());
		halfOpenSuccesses = 0;
		log.warn("서킷 브레이커 {} OPEN, 재시도 예정 시각 {}", name, nextAttemptTime);
		return changeState(CircuitBreakerState.OPEN, now);
	}

	private CircuitBreakerStateChangeEvent changeState(CircuitBreakerState newState, Instant now) {
		CircuitBreakerState previous = state;
		if (previous == newState) {
			return null;
		}
		state = newState;
		log.info("서킷 브레이커 {} 상태 전이: {} -> {}", name, previous, newState);
		return new CircuitBreakerStateChangeEvent(name, previous, newState, now);
	}

	private void pruneFailures(Instant now) {
		Instant windowStart = now.minus(config.rollingWindow());
		while (!failureTimestamps.isEmpty() && !failureTimestamps.peekFirst().isAfter(windowStart)) {
			failureTimestamps.pollFirst();
		}
	}

	private void publish(CircuitBreakerStateChangeEvent event) {
		if (event == null) {
			return;
		}
		try {
			stateChangeListener.accept(event);
		} catch (RuntimeException e) {
			log.error("서킷 브레이커 {} 상태 변경 리스너 실패", name, e);
		}
	}
}

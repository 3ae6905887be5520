package com.study.webflux.voice.infrastructure.resilience.circuit;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import lombok.extern.slf4j.Slf4j;

/**
 * 서비스 이름별 서킷 브레이커를 지연 생성하고 보관합니다.
 *
 * <p>
 * 브레이커는 세션이 아닌 다운스트림 서비스를 보호하므로 프로세스 수명 동안 유지되며 모든 파이프라인이 공유합니다.
 */
@Slf4j
public class CircuitBreakerManager {

	private final CircuitBreakerConfig defaultConfig;
	private final Clock clock;
	private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

	private volatile Consumer<CircuitBreaker> registrationListener = breaker -> {
	};
	private volatile Consumer<CircuitBreakerStateChangeEvent> stateChangeListener = event -> {
	};

	public CircuitBreakerManager(CircuitBreakerConfig defaultConfig, Clock clock) {
		this.defaultConfig = defaultConfig;
		this.clock = clock;
	}

	/**
	 * 새 브레이커가 생성될 때 호출될 리스너를 등록합니다.
	 */
	public void setRegistrationListener(Consumer<CircuitBreaker> listener) {
		this.registrationListener = listener;
	}

	/**
	 * 모든 브레이커의 상태 전이를 전달받을 리스너를 등록합니다.
	 */
	public void setStateChangeListener(Consumer<CircuitBreakerStateChangeEvent> listener) {
		this.stateChangeListener = listener;
	}

	public CircuitBreaker getBreaker(String name) {
		return getBreaker(name, defaultConfig);
	}

	/**
	 * 이름에 해당하는 브레이커를 반환합니다. 이미 존재하면 설정 인자는 무시됩니다.
	 */
	public CircuitBreaker getBreaker(String name, CircuitBreakerConfig config) {
		CircuitBreaker existing = breakers.get(name);
		if (existing != null) {
			return existing;
		}

		boolean[] created = {false};
		CircuitBreaker breaker = breakers.computeIfAbsent(name, key -> {
			CircuitBreaker newBreaker = new CircuitBreaker(key, config, clock);
			newBreaker.setStateChangeListener(event -> stateChangeListener.accept(event));
			created[0] = true;
			return newBreaker;
		});

		if (created[0]) {
			log.info("서킷 브레이커 생성: {} (failureThreshold={}, timeout={})",
				name,
				config.failureThreshold(),
				config.timeout());
			registrationListener.accept(breaker);
		}
		return breaker;
	}

	public Collection<CircuitBreaker> getAllBreakers() {
		return List.copyOf(breakers.values());
	}

	/**
	 * 서비스별 상태, 사용 가능 여부, 지표를 이름 순으로 집계합니다.
	 */
	public Map<String, CircuitBreakerStatus> getHealthStatus() {
		Map<String, CircuitBreakerStatus> status = new TreeMap<>();
		breakers.forEach((name, breaker) -> status.put(name, breaker.getStatus()));
		return status;
	}

	public void resetAll() {
		breakers.values().forEach(CircuitBreaker::reset);
		log.info("서킷 브레이커 {}개 초기화", breakers.size());
	}
}

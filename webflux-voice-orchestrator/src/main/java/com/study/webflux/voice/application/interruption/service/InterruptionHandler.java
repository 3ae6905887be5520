package com.study.webflux.voice.application.interruption.service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.voice.application.orchestration.service.PipelineOrchestrator;
import com.study.webflux.voice.domain.interruption.model.InterruptionEvent;
import com.study.webflux.voice.domain.interruption.model.InterruptionStats;
import com.study.webflux.voice.domain.interruption.model.InterruptionTrigger;
import com.study.webflux.voice.infrastructure.pipeline.config.properties.VoicePipelineProperties;
import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * 음성 활동(VAD) 신호로 바지인 중단을 감지합니다.
 *
 * <p>
 * VAD 신호는 다음 조건을 모두 통과해야 중단을 일으킵니다.
 * <ul>
 * <li>세션이 쿨다운 중이 아님</li>
 * <li>confidence ≥ vadThreshold</li>
 * <li>지속 시간 ≥ vadDuration</li>
 * </ul>
 * 수동 중단은 모든 조건을 건너뜁니다. 중단 후 세션별 쿨다운 타이머가 시작되며 반복 중단 시 기존 타이머를 교체합니다.
 *
 * <p>
 * 조건 검사와 쿨다운 시작은 세션 단위로 직렬화됩니다. 파이프라인 중단과 이벤트 발행은 잠금 밖에서 실행되므로 한 세션의
 * 느린 구독자가 다른 세션의 중단을 지연시키지 않습니다.
 */
@Slf4j
@Component
public class InterruptionHandler {

	private static final int MAX_EVENTS_PER_SESSION = 10;
	private static final int RECENT_EVENTS_LIMIT = 5;
	private static final Duration EMIT_RETRY = Duration.ofMillis(100);

	private final PipelineOrchestrator orchestrator;
	private final Clock clock;
	private final Scheduler scheduler;
	private final double vadThreshold;
	private final Duration vadDuration;
	private final Duration cooldown;

	private final Map<String, Object> sessionLocks = new ConcurrentHashMap<>();
	private final Map<String, Deque<InterruptionEvent>> sessionHistory = new ConcurrentHashMap<>();
	private final Map<String, Disposable> cooldownTimers = new ConcurrentHashMap<>();
	private final Sinks.Many<InterruptionEvent> eventSink = Sinks.many().multicast()
		.directBestEffort();

	public InterruptionHandler(PipelineOrchestrator orchestrator,
		VoicePipelineProperties properties,
		Clock clock,
		Scheduler scheduler) {
		this.orchestrator = orchestrator;
		this.clock = clock;
		this.scheduler = scheduler;
		VoicePipelineProperties.Interruption interruption = properties.getInterruption();
		this.vadThreshold = interruption.getVadThreshold();
		this.vadDuration = interruption.getVadDuration();
		this.cooldown = interruption.getCooldown();
	}

	/**
	 * VAD 신호를 처리합니다.
	 *
	 * @return 중단을 일으켰으면 true
	 */
	public boolean handleVAD(String pipelineId, String sessionId, double confidence,
		long durationMs) {
		if (orchestrator.getPipelineState(pipelineId).isEmpty()) {
			log.debug("VAD 신호 대상 파이프라인 없음: {}", pipelineId);
			return false;
		}

		synchronized (lockFor(sessionId)) {
			if (isInCooldown(sessionId)) {
				log.debug("쿨다운 중 VAD 신호 무시: sessionId={}", sessionId);
				return false;
			}
			if (confidence < vadThreshold) {
				log.debug("VAD 신뢰도 부족: {} < {}", confidence, vadThreshold);
				return false;
			}
			if (durationMs < vadDuration.toMillis()) {
				log.debug("VAD 지속 시간 부족: {}ms < {}ms", durationMs, vadDuration.toMillis());
				return false;
			}
			startCooldown(sessionId);
		}
		triggerInterruption(pipelineId, sessionId, InterruptionTrigger.VAD, confidence);
		return true;
	}

	/**
	 * 사용자 요청으로 즉시 중단합니다. 쿨다운과 VAD 조건을 적용하지 않습니다.
	 *
	 * @return 파이프라인이 없으면 false
	 */
	public boolean manualInterrupt(String pipelineId, String sessionId) {
		if (orchestrator.getPipelineState(pipelineId).isEmpty()) {
			log.debug("수동 중단 대상 파이프라인 없음: {}", pipelineId);
			return false;
		}
		synchronized (lockFor(sessionId)) {
			startCooldown(sessionId);
		}
		triggerInterruption(pipelineId, sessionId, InterruptionTrigger.MANUAL, 1.0);
		return true;
	}

	private Object lockFor(String sessionId) {
		return sessionLocks.computeIfAbsent(sessionId, key -> new Object());
	}

	private void triggerInterruption(String pipelineId, String sessionId,
		InterruptionTrigger trigger, double confidence) {
		InterruptionEvent event = new InterruptionEvent(pipelineId, sessionId, clock.instant(),
			trigger, confidence);
		record(event);

		log.info("파이프라인 중단 발생: pipelineId={}, trigger={}, confidence={}",
			pipelineId,
			trigger.getValue(),
			confidence);
		orchestrator.interruptPipeline(pipelineId);

		eventSink.emitNext(event, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
	}

	private void record(InterruptionEvent event) {
		Deque<InterruptionEvent> events = sessionHistory.computeIfAbsent(event.sessionId(),
			key -> new ArrayDeque<>());
		synchronized (events) {
			events.addLast(event);
			while (events.size() > MAX_EVENTS_PER_SESSION) {
				events.pollFirst();
			}
		}
	}

	private void startCooldown(String sessionId) {
		AtomicReference<Disposable> self = new AtomicReference<>();
		Disposable timer = Mono.delay(cooldown, scheduler)
			.subscribe(ignored -> {
				Disposable current = self.get();
				if (current != null) {
					cooldownTimers.remove(sessionId, current);
				}
			});
		self.set(timer);

		Disposable previous = cooldownTimers.put(sessionId, timer);
		if (previous != null) {
			previous.dispose();
		}
	}

	public boolean isInCooldown(String sessionId) {
		return cooldownTimers.containsKey(sessionId);
	}

	/** 모든 중단 이벤트입니다. */
	public Flux<InterruptionEvent> events() {
		return eventSink.asFlux();
	}

	public Flux<InterruptionEvent> sessionEvents(String sessionId) {
		return eventSink.asFlux().filter(event -> event.sessionId().equals(sessionId));
	}

	public Flux<InterruptionEvent> pipelineEvents(String pipelineId) {
		return eventSink.asFlux().filter(event -> event.pipelineId().equals(pipelineId));
	}

	/**
	 * 세션의 중단 통계를 집계합니다.
	 */
	public InterruptionStats getSessionStats(String sessionId) {
		Deque<InterruptionEvent> events = sessionHistory.get(sessionId);
		List<InterruptionEvent> snapshot;
		if (events == null) {
			snapshot = List.of();
		} else {
			synchronized (events) {
				snapshot = List.copyOf(events);
			}
		}

		Map<String, Long> byTrigger = snapshot.stream()
			.collect(Collectors.groupingBy(event -> event.trigger().getValue(),
				LinkedHashMap::new,
				Collectors.counting()));
		double averageConfidence = snapshot.stream()
			.mapToDouble(InterruptionEvent::confidence)
			.average()
			.orElse(0.0);
		List<InterruptionEvent> recent = snapshot.subList(
			Math.max(0, snapshot.size() - RECENT_EVENTS_LIMIT), snapshot.size());

		return new InterruptionStats(snapshot.size(), byTrigger, averageConfidence,
			List.copyOf(recent));
	}

	public void clearSessionHistory(String sessionId) {
		sessionHistory.remove(sessionId);
		sessionLocks.remove(sessionId);
		Disposable timer = cooldownTimers.remove(sessionId);
		if (timer != null) {
			timer.dispose();
		}
	}

	@PreDestroy
	public void shutdown() {
		cooldownTimers.values().forEach(Disposable::dispose);
		cooldownTimers.clear();
		sessionHistory.clear();
		sessionLocks.clear();
		eventSink.tryEmitComplete();
	}
}

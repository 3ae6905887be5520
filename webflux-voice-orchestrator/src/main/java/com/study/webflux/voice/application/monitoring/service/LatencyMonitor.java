package com.study.webflux.voice.application.monitoring.service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.voice.domain.monitoring.model.LatencyAlert;
import com.study.webflux.voice.domain.monitoring.model.LatencyStats;
import com.study.webflux.voice.domain.monitoring.model.LatencyThresholds;
import com.study.webflux.voice.domain.monitoring.model.LatencyThresholdsUpdate;
import com.study.webflux.voice.domain.pipeline.model.PipelineMetrics;
import com.study.webflux.voice.domain.pipeline.model.PipelineStage;
import com.study.webflux.voice.domain.pipeline.model.PipelineState;
import com.study.webflux.voice.infrastructure.pipeline.config.properties.VoicePipelineProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * 파이프라인 지연을 SLA 임계값과 비교하고 Micrometer로 내보냅니다.
 *
 * <p>
 * 첫 토큰, 종단 간 지연은 임계값 초과 시 경보를 남기고, 단계 간 지연은 위반 카운터만 증가시킵니다. 위반은 관측값이 임계값보다 클
 * 때만 기록합니다.
 */
@Slf4j
@Component
public class LatencyMonitor {

	private static final String METRIC_PREFIX = "voice.pipeline";
	private static final int MAX_ALERTS = 100;
	private static final int RECENT_ALERTS_LIMIT = 5;

	static final String STAGE_FIRST_TOKEN = "first-token";
	static final String STAGE_END_TO_END = "end-to-end";
	static final String STAGE_AUDIO_TO_ASR = "audio-to-asr";
	static final String STAGE_ASR_TO_LLM = "asr-to-llm";
	static final String STAGE_LLM_TO_TTS = "llm-to-tts";
	static final String STAGE_TTS_TO_CLIENT = "tts-to-client";

	private final MeterRegistry meterRegistry;
	private final Clock clock;
	private final AtomicInteger activePipelines = new AtomicInteger();
	private final Deque<LatencyAlert> alerts = new ArrayDeque<>();
	private final Map<String, AtomicLong> stageViolations = new ConcurrentHashMap<>();
	private final Sinks.Many<LatencyAlert> violationSink = Sinks.many().multicast()
		.directBestEffort();

	private volatile LatencyThresholds thresholds;

	public LatencyMonitor(MeterRegistry meterRegistry, VoicePipelineProperties properties,
		Clock clock) {
		this.meterRegistry = meterRegistry;
		this.clock = clock;
		VoicePipelineProperties.Latency latency = properties.getLatency();
		this.thresholds = new LatencyThresholds(latency.getFirstToken(),
			latency.getAudioToAsr(),
			latency.getAsrToLlm(),
			latency.getLlmToTts(),
			latency.getTtsToClient(),
			latency.getEndToEnd());

		Gauge.builder(METRIC_PREFIX + ".active", activePipelines, AtomicInteger::get)
			.description("Number of active voice pipelines")
			.register(meterRegistry);
	}

	public void startMonitoring(String pipelineId, String sessionId) {
		int active = activePipelines.incrementAndGet();
		log.debug("지연 모니터링 시작: pipelineId={}, sessionId={}, active={}",
			pipelineId,
			sessionId,
			active);
	}

	/**
	 * 종료된 파이프라인의 지연을 기록하고 임계값을 검사합니다.
	 */
	public void stopMonitoring(PipelineState state) {
		activePipelines.updateAndGet(value -> Math.max(0, value - 1));

		PipelineMetrics metrics = state.getMetrics();
		LatencyThresholds current = thresholds;

		if (metrics.totalLatency() != null) {
			Timer.builder(METRIC_PREFIX + ".latency")
				.tag("status", completionStatus(state.getStage()))
				.description("End-to-end voice pipeline latency")
				.register(meterRegistry)
				.record(metrics.totalLatency(), TimeUnit.MILLISECONDS);
			if (metrics.totalLatency() > current.endToEnd()) {
				recordAlert(state, STAGE_END_TO_END, metrics.totalLatency(), current.endToEnd());
			}
		}

		if (metrics.firstTokenLatency() != null) {
			Timer.builder(METRIC_PREFIX + ".first_token.latency")
				.description("Time to first LLM token")
				.register(meterRegistry)
				.record(metrics.firstTokenLatency(), TimeUnit.MILLISECONDS);
			if (metrics.firstTokenLatency() > current.firstToken()) {
				recordAlert(state, STAGE_FIRST_TOKEN, metrics.firstTokenLatency(),
					current.firstToken());
			}
		}

		recordStage(STAGE_AUDIO_TO_ASR, metrics.audioToAsrLatency(), current.audioToAsr());
		recordStage(STAGE_ASR_TO_LLM, metrics.asrToLlmLatency(), current.asrToLlm());
		recordStage(STAGE_LLM_TO_TTS, metrics.llmToTtsLatency(), current.llmToTts());
		recordStage(STAGE_TTS_TO_CLIENT, metrics.ttsToClientLatency(), current.ttsToClient());
	}

	private void recordStage(String stage, Long actual, long threshold) {
		if (actual == null) {
			return;
		}
		Timer.builder(METRIC_PREFIX + ".stage.latency")
			.tag("stage", stage)
			.description("Latency between pipeline stages")
			.register(meterRegistry)
			.record(actual, TimeUnit.MILLISECONDS);
		if (actual > threshold) {
			incrementViolation(stage);
		}
	}

	private void recordAlert(PipelineState state, String stage, long actual, long threshold) {
		LatencyAlert alert = new LatencyAlert(state.getId(), state.getSessionId(), stage, actual,
			threshold, clock.instant());
		synchronized (alerts) {
			alerts.addLast(alert);
			while (alerts.size() > MAX_ALERTS) {
				alerts.pollFirst();
			}
			violationSink.tryEmitNext(alert);
		}
		incrementViolation(stage);
		log.warn("지연 SLA 위반: pipelineId={}, stage={}, actual={}ms, threshold={}ms",
			state.getId(),
			stage,
			actual,
			threshold);
	}

	private void incrementViolation(String stage) {
		stageViolations.computeIfAbsent(stage, key -> new AtomicLong()).incrementAndGet();
		Counter.builder(METRIC_PREFIX + ".sla.violations")
			.tag("stage", stage)
			.description("Number of latency SLA violations")
			.register(meterRegistry)
			.increment();
	}

	private static String completionStatus(PipelineStage stage) {
		return switch (stage) {
			case COMPLETED -> "completed";
			case INTERRUPTED -> "interrupted";
			case ERROR -> "failed";
			default -> "abandoned";
		};
	}

	public LatencyStats getStats() {
		List<LatencyAlert> snapshot = snapshotAlerts();
		Map<String, Long> byStage = snapshot.stream()
			.collect(Collectors.groupingBy(LatencyAlert::stage,
				LinkedHashMap::new,
				Collectors.counting()));
		Map<String, Long> cumulative = new TreeMap<>();
		stageViolations.forEach((stage, count) -> cumulative.put(stage, count.get()));
		List<LatencyAlert> recent = snapshot.subList(
			Math.max(0, snapshot.size() - RECENT_ALERTS_LIMIT), snapshot.size());

		return new LatencyStats(thresholds, snapshot.size(), byStage, cumulative,
			List.copyOf(recent));
	}

	public List<LatencyAlert> getRecentViolations() {
		return getRecentViolations(10);
	}

	public List<LatencyAlert> getRecentViolations(int limit) {
		List<LatencyAlert> snapshot = snapshotAlerts();
		int from = Math.max(0, snapshot.size() - Math.max(0, limit));
		return List.copyOf(snapshot.subList(from, snapshot.size()));
	}

	/**
	 * 임계값을 부분 변경합니다. 진행 중인 모니터링에 즉시 반영됩니다.
	 */
	public synchronized LatencyThresholds updateThresholds(LatencyThresholdsUpdate update) {
		thresholds = thresholds.merge(update);
		log.info("지연 임계값 변경: {}", thresholds);
		return thresholds;
	}

	public LatencyThresholds getThresholds() {
		return thresholds;
	}

	public void clearAlerts() {
		synchronized (alerts) {
			alerts.clear();
		}
	}

	public int getActivePipelineCount() {
		return activePipelines.get();
	}

	/** 외부 알림 연동용 위반 경보 스트림입니다. */
	public Flux<LatencyAlert> violations() {
		return violationSink.asFlux();
	}

	private List<LatencyAlert> snapshotAlerts() {
		synchronized (alerts) {
			return List.copyOf(alerts);
		}
	}
}

package com.study.webflux.voice.application.orchestration.controller;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.voice.application.interruption.service.InterruptionHandler;
import com.study.webflux.voice.application.monitoring.service.LatencyMonitor;
import com.study.webflux.voice.application.orchestration.controller.docs.OrchestrationApi;
import com.study.webflux.voice.application.orchestration.dto.ActivePipelinesResponse;
import com.study.webflux.voice.application.orchestration.dto.HealthResponse;
import com.study.webflux.voice.application.orchestration.dto.PipelineActionResponse;
import com.study.webflux.voice.application.orchestration.dto.StartPipelineRequest;
import com.study.webflux.voice.application.orchestration.dto.StartPipelineResponse;
import com.study.webflux.voice.application.orchestration.service.PipelineCallbacks;
import com.study.webflux.voice.application.orchestration.service.PipelineOrchestrator;
import com.study.webflux.voice.domain.interruption.model.InterruptionStats;
import com.study.webflux.voice.domain.monitoring.model.LatencyAlert;
import com.study.webflux.voice.domain.monitoring.model.LatencyStats;
import com.study.webflux.voice.domain.monitoring.model.LatencyThresholds;
import com.study.webflux.voice.domain.monitoring.model.LatencyThresholdsUpdate;
import com.study.webflux.voice.domain.pipeline.model.PipelineSnapshot;
import com.study.webflux.voice.domain.pipeline.model.PipelineState;
import com.study.webflux.voice.infrastructure.resilience.circuit.CircuitBreakerStatus;
import jakarta.validation.Valid;
import reactor.core.publisher.Mono;

/** 음성 파이프라인 제어와 운영 상태 조회용 REST 컨트롤러입니다. */
@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/orchestration")
public class OrchestrationController implements OrchestrationApi {

	private final PipelineOrchestrator orchestrator;
	private final InterruptionHandler interruptionHandler;
	private final LatencyMonitor latencyMonitor;
	private final Clock clock;

	/**
	 * REST로 시작한 파이프라인은 구독자가 없으므로 이벤트를 로그로만 남깁니다.
	 */
	@PostMapping("/start")
	public Mono<StartPipelineResponse> startPipeline(
		@Valid @RequestBody StartPipelineRequest request) {
		return Mono.fromCallable(() -> {
			PipelineState state = orchestrator.startPipeline(request.sessionId(),
				request.userId(),
				loggingCallbacks());
			return new StartPipelineResponse(state.getId(), state.getSessionId(), "started",
				state.getStage());
		});
	}

	@GetMapping("/pipeline/{pipelineId}")
	public Mono<PipelineSnapshot> getPipeline(@PathVariable String pipelineId) {
		return Mono.justOrEmpty(orchestrator.getPipelineState(pipelineId))
			.map(PipelineState::getSnapshot)
			.switchIfEmpty(Mono.error(() -> notFound(pipelineId)));
	}

	@PostMapping("/interrupt/{pipelineId}")
	public Mono<PipelineActionResponse> interruptPipeline(@PathVariable String pipelineId) {
		return Mono.justOrEmpty(orchestrator.getPipelineState(pipelineId))
			.filter(state -> interruptionHandler.manualInterrupt(pipelineId, state.getSessionId()))
			.map(state -> new PipelineActionResponse(pipelineId, "interrupted", clock.instant()))
			.switchIfEmpty(Mono.error(() -> notFound(pipelineId)));
	}

	@PostMapping("/end/{pipelineId}")
	public Mono<PipelineActionResponse> endPipeline(@PathVariable String pipelineId) {
		return Mono.justOrEmpty(orchestrator.endPipeline(pipelineId))
			.map(snapshot -> new PipelineActionResponse(pipelineId, "ended", clock.instant()))
			.switchIfEmpty(Mono.error(() -> notFound(pipelineId)));
	}

	@GetMapping("/pipelines")
	public Mono<ActivePipelinesResponse> getActivePipelines() {
		return Mono.fromSupplier(() -> {
			List<PipelineSnapshot> snapshots = orchestrator.getActivePipelines().stream()
				.map(PipelineState::getSnapshot)
				.toList();
			return new ActivePipelinesResponse(snapshots.size(), snapshots);
		});
	}

	@GetMapping("/latency/stats")
	public Mono<LatencyStats> getLatencyStats() {
		return Mono.fromSupplier(latencyMonitor::getStats);
	}

	@GetMapping("/latency/violations")
	public Mono<List<LatencyAlert>> getLatencyViolations(
		@RequestParam(defaultValue = "10") int limit) {
		return Mono.fromSupplier(() -> latencyMonitor.getRecentViolations(limit));
	}

	@PatchMapping("/latency/thresholds")
	public Mono<LatencyThresholds> updateLatencyThresholds(
		@RequestBody LatencyThresholdsUpdate update) {
		return Mono.fromCallable(() -> latencyMonitor.updateThresholds(update))
			.onErrorMap(IllegalArgumentException.class,
				e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e));
	}

	@DeleteMapping("/latency/alerts")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public Mono<Void> clearLatencyAlerts() {
		return Mono.fromRunnable(latencyMonitor::clearAlerts);
	}

	@GetMapping("/interruptions/{sessionId}")
	public Mono<InterruptionStats> getInterruptionStats(@PathVariable String sessionId) {
		return Mono.fromSupplier(() -> interruptionHandler.getSessionStats(sessionId));
	}

	@GetMapping("/circuit-breakers")
	public Mono<Map<String, CircuitBreakerStatus>> getCircuitBreakers() {
		return Mono.fromSupplier(orchestrator::getCircuitBreakerStatus);
	}

	@PostMapping("/circuit-breakers/reset")
	public Mono<Map<String, CircuitBreakerStatus>> resetCircuitBreakers() {
		return Mono.fromSupplier(() -> {
			orchestrator.resetCircuitBreakers();
			return orchestrator.getCircuitBreakerStatus();
		});
	}

	@GetMapping("/health")
	public Mono<ResponseEntity<HealthResponse>> health() {
		return orchestrator.healthCheck().map(services -> {
			boolean healthy = services.values().stream().allMatch(Boolean::booleanValue);
			HealthResponse body = new HealthResponse(healthy ? "healthy" : "degraded", services,
				clock.instant());
			return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
				.body(body);
		});
	}

	private static ResponseStatusException notFound(String pipelineId) {
		return new ResponseStatusException(HttpStatus.NOT_FOUND,
			"Pipeline not found: " + pipelineId);
	}

	private static PipelineCallbacks loggingCallbacks() {
		return PipelineCallbacks.builder()
			.onTranscriptFinal(text -> log.info("최종 전사: {}", text))
			.onComplete(state -> log.info("파이프라인 완료: {}", state.getId()))
			.onError(error -> log.warn("파이프라인 오류: {}", error.getMessage()))
			.onInterrupt(() -> log.info("파이프라인 중단됨"))
			.build();
	}
}

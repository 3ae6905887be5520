package com.study.webflux.voice.application.orchestration.controller;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.study.webflux.voice.application.interruption.service.InterruptionHandler;
import com.study.webflux.voice.application.monitoring.service.LatencyMonitor;
import com.study.webflux.voice.application.orchestration.dto.StartPipelineRequest;
import com.study.webflux.voice.application.orchestration.service.PipelineCallbacks;
import com.study.webflux.voice.application.orchestration.service.PipelineOrchestrator;
import com.study.webflux.voice.config.annotation.ControllerWebFluxTest;
import com.study.webflux.voice.domain.interruption.model.InterruptionStats;
import com.study.webflux.voice.domain.monitoring.model.LatencyThresholds;
import com.study.webflux.voice.domain.monitoring.model.LatencyThresholdsUpdate;
import com.study.webflux.voice.domain.pipeline.model.PipelineStage;
import com.study.webflux.voice.domain.pipeline.model.PipelineState;
import com.study.webflux.voice.fixture.PipelineStateFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ControllerWebFluxTest(OrchestrationController.class)
class OrchestrationControllerTest {

	@Autowired
	private WebTestClient webTestClient;

	@Autowired
	private Clock clock;

	@MockitoBean
	private PipelineOrchestrator orchestrator;

	@MockitoBean
	private InterruptionHandler interruptionHandler;

	@MockitoBean
	private LatencyMonitor latencyMonitor;

	@Test
	@DisplayName("파이프라인 시작 요청 시 ID와 초기 단계를 반환한다")
	void startPipeline_shouldReturnPipelineId() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.AUDIO_CAPTURE, clock);
		when(orchestrator.startPipeline(eq("session-1"), eq("user-1"), any(PipelineCallbacks.class)))
			.thenReturn(state);

		webTestClient.post().uri("/api/orchestration/start")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(new StartPipelineRequest("session-1", "user-1"))
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.pipelineId").isEqualTo(state.getId())
			.jsonPath("$.sessionId").isEqualTo("session-1")
			.jsonPath("$.status").isEqualTo("started")
			.jsonPath("$.stage").isEqualTo("AUDIO_CAPTURE");
	}

	@Test
	@DisplayName("userId가 비어 있으면 400 Bad Request를 반환한다")
	void startPipeline_withBlankUserId_shouldReturnBadRequest() {
		webTestClient.post().uri("/api/orchestration/start")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(new StartPipelineRequest("session-1", " "))
			.exchange()
			.expectStatus().isBadRequest();

		verify(orchestrator, never()).startPipeline(any(), any(), any());
	}

	@Test
	@DisplayName("파이프라인 조회 시 스냅샷을 반환한다")
	void getPipeline_shouldReturnSnapshot() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.ASR_PROCESSING,
			clock);
		when(orchestrator.getPipelineState(state.getId())).thenReturn(Optional.of(state));

		webTestClient.get().uri("/api/orchestration/pipeline/{id}", state.getId())
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.id").isEqualTo(state.getId())
			.jsonPath("$.stage").isEqualTo("ASR_PROCESSING")
			.jsonPath("$.interrupted").isEqualTo(false);
	}

	@Test
	@DisplayName("없는 파이프라인 조회 시 404를 반환한다")
	void getPipeline_unknown_shouldReturnNotFound() {
		when(orchestrator.getPipelineState("missing")).thenReturn(Optional.empty());

		webTestClient.get().uri("/api/orchestration/pipeline/missing")
			.exchange()
			.expectStatus().isNotFound();
	}

	@Test
	@DisplayName("수동 중단 요청은 세션 ID와 함께 중단 핸들러에 위임한다")
	void interrupt_shouldDelegateToInterruptionHandler() {
		PipelineState state = PipelineStateFixture.advancedTo(PipelineStage.AUDIO_PLAYBACK,
			clock);
		when(orchestrator.getPipelineState(state.getId())).thenReturn(Optional.of(state));
		when(interruptionHandler.manualInterrupt(state.getId(), "session-1")).thenReturn(true);

		webTestClient.post().uri("/api/orchestration/interrupt/{id}", state.getId())
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.pipelineId").isEqualTo(state.getId())
			.jsonPath("$.status").isEqualTo("interrupted")
			.jsonPath("$.timestamp").isEqualTo("2024-12-21T12:00:00Z");

		verify(interruptionHandler).manualInterrupt(state.getId(), "session-1");
	}

	@Test
	@DisplayName("없는 파이프라인 중단 요청 시 404를 반환한다")
	void interrupt_unknown_shouldReturnNotFound() {
		when(orchestrator.getPipelineState("missing")).thenReturn(Optional.empty());

		webTestClient.post().uri("/api/orchestration/interrupt/missing")
			.exchange()
			.expectStatus().isNotFound();

		verify(interruptionHandler, never()).manualInterrupt(any(), any());
	}

	@Test
	@DisplayName("종료 요청 시 파이프라인을 정리하고 ended 상태를 반환한다")
	void end_shouldReturnEnded() {
		PipelineState state = PipelineStateFixture.create(clock);
		when(orchestrator.endPipeline(state.getId())).thenReturn(Optional.of(state.getSnapshot()));

		webTestClient.post().uri("/api/orchestration/end/{id}", state.getId())
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.status").isEqualTo("ended");
	}

	@Test
	@DisplayName("활성 파이프라인 목록과 개수를 반환한다")
	void pipelines_shouldReturnActiveSnapshots() {
		when(orchestrator.getActivePipelines()).thenReturn(List.of(
			PipelineStateFixture.create("session-a", clock),
			PipelineStateFixture.create("session-b", clock)));

		webTestClient.get().uri("/api/orchestration/pipelines")
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.count").isEqualTo(2)
			.jsonPath("$.pipelines[0].sessionId").isEqualTo("session-a")
			.jsonPath("$.pipelines[1].sessionId").isEqualTo("session-b");
	}

	@Test
	@DisplayName("위반 조회 limit이 1보다 작으면 400 Bad Request를 반환한다")
	void violations_withInvalidLimit_shouldReturnBadRequest() {
		webTestClient.get().uri("/api/orchestration/latency/violations?limit=0")
			.exchange()
			.expectStatus().isBadRequest();

		verify(latencyMonitor, never()).getRecentViolations(anyInt());
	}

	@Test
	@DisplayName("임계값 부분 변경 결과를 반환한다")
	void updateThresholds_shouldReturnMergedThresholds() {
		LatencyThresholdsUpdate update = new LatencyThresholdsUpdate(300L, null, null, null,
			null, null);
		when(latencyMonitor.updateThresholds(update))
			.thenReturn(LatencyThresholds.defaults().merge(update));

		webTestClient.patch().uri("/api/orchestration/latency/thresholds")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(update)
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.firstToken").isEqualTo(300)
			.jsonPath("$.endToEnd").isEqualTo(2000);
	}

	@Test
	@DisplayName("양수가 아닌 임계값은 400 Bad Request를 반환한다")
	void updateThresholds_nonPositive_shouldReturnBadRequest() {
		LatencyThresholdsUpdate update = new LatencyThresholdsUpdate(0L, null, null, null, null,
			null);
		when(latencyMonitor.updateThresholds(update))
			.thenThrow(new IllegalArgumentException("latency thresholds must be positive"));

		webTestClient.patch().uri("/api/orchestration/latency/thresholds")
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(update)
			.exchange()
			.expectStatus().isBadRequest();
	}

	@Test
	@DisplayName("경보 초기화 시 204 No Content를 반환한다")
	void clearAlerts_shouldReturnNoContent() {
		webTestClient.delete().uri("/api/orchestration/latency/alerts")
			.exchange()
			.expectStatus().isNoContent();

		verify(latencyMonitor).clearAlerts();
	}

	@Test
	@DisplayName("세션 중단 통계를 반환한다")
	void interruptionStats_shouldReturnSessionStats() {
		when(interruptionHandler.getSessionStats("session-1"))
			.thenReturn(new InterruptionStats(2, Map.of("vad", 2L), 0.85, List.of()));

		webTestClient.get().uri("/api/orchestration/interruptions/session-1")
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.totalInterruptions").isEqualTo(2)
			.jsonPath("$.byTrigger.vad").isEqualTo(2)
			.jsonPath("$.averageConfidence").isEqualTo(0.85);
	}

	@Test
	@DisplayName("서킷 브레이커 초기화 후 상태를 반환한다")
	void resetCircuitBreakers_shouldResetAll() {
		when(orchestrator.getCircuitBreakerStatus()).thenReturn(Map.of());

		webTestClient.post().uri("/api/orchestration/circuit-breakers/reset")
			.exchange()
			.expectStatus().isOk();

		verify(orchestrator).resetCircuitBreakers();
	}

	@Test
	@DisplayName("모든 서비스가 정상이면 200 healthy를 반환한다")
	void health_allHealthy_shouldReturnOk() {
		Map<String, Boolean> services = new LinkedHashMap<>();
		services.put("asr", true);
		services.put("llm", true);
		when(orchestrator.healthCheck()).thenReturn(Mono.just(services));

		webTestClient.get().uri("/api/orchestration/health")
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.status").isEqualTo("healthy")
			.jsonPath("$.services.asr").isEqualTo(true);
	}

	@Test
	@DisplayName("하나라도 비정상이면 503 degraded를 반환한다")
	void health_oneDown_shouldReturnServiceUnavailable() {
		Map<String, Boolean> services = new LinkedHashMap<>();
		services.put("asr", true);
		services.put("tts", false);
		when(orchestrator.healthCheck()).thenReturn(Mono.just(services));

		webTestClient.get().uri("/api/orchestration/health")
			.exchange()
			.expectStatus().isEqualTo(503)
			.expectBody()
			.jsonPath("$.status").isEqualTo("degraded")
			.jsonPath("$.services.tts").isEqualTo(false);
	}
}

package com.study.webflux.voice.application.orchestration.controller.docs;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;

import com.study.webflux.voice.application.orchestration.dto.ActivePipelinesResponse;
import com.study.webflux.voice.application.orchestration.dto.HealthResponse;
import com.study.webflux.voice.application.orchestration.dto.PipelineActionResponse;
import com.study.webflux.voice.application.orchestration.dto.StartPipelineRequest;
import com.study.webflux.voice.application.orchestration.dto.StartPipelineResponse;
import com.study.webflux.voice.domain.interruption.model.InterruptionStats;
import com.study.webflux.voice.domain.monitoring.model.LatencyAlert;
import com.study.webflux.voice.domain.monitoring.model.LatencyStats;
import com.study.webflux.voice.domain.monitoring.model.LatencyThresholds;
import com.study.webflux.voice.domain.monitoring.model.LatencyThresholdsUpdate;
import com.study.webflux.voice.domain.pipeline.model.PipelineSnapshot;
import com.study.webflux.voice.infrastructure.resilience.circuit.CircuitBreakerStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import reactor.core.publisher.Mono;

@Tag(
	name = "오케스트레이션 API",
	description = "음성 파이프라인 제어, 지연 SLA, 중단 통계, 서킷 브레이커 상태"
)
public interface OrchestrationApi {

	@Operation(
		summary = "파이프라인 시작",
		description = "세션에 새 음성 파이프라인을 만들고 AUDIO_CAPTURE 단계로 전이합니다"
	)
	@ApiResponse(responseCode = "200", description = "파이프라인 시작됨")
	@ApiResponse(responseCode = "400", description = "sessionId 또는 userId 누락")
	Mono<StartPipelineResponse> startPipeline(
		@Valid StartPipelineRequest request
	);

	@Operation(summary = "파이프라인 상태 조회")
	@ApiResponse(responseCode = "200", description = "파이프라인 스냅샷")
	@ApiResponse(responseCode = "404", description = "활성 파이프라인 없음")
	Mono<PipelineSnapshot> getPipeline(
		@Parameter(description = "파이프라인 ID") String pipelineId
	);

	@Operation(
		summary = "파이프라인 수동 중단",
		description = "쿨다운과 VAD 조건 없이 즉시 중단합니다"
	)
	@ApiResponse(responseCode = "200", description = "중단됨")
	@ApiResponse(responseCode = "404", description = "활성 파이프라인 없음")
	Mono<PipelineActionResponse> interruptPipeline(
		@Parameter(description = "파이프라인 ID") String pipelineId
	);

	@Operation(
		summary = "파이프라인 종료",
		description = "음성 인식 연결을 정리하고 활성 목록에서 제거합니다"
	)
	@ApiResponse(responseCode = "200", description = "종료됨")
	@ApiResponse(responseCode = "404", description = "활성 파이프라인 없음")
	Mono<PipelineActionResponse> endPipeline(
		@Parameter(description = "파이프라인 ID") String pipelineId
	);

	@Operation(summary = "활성 파이프라인 목록")
	Mono<ActivePipelinesResponse> getActivePipelines();

	@Operation(summary = "지연 SLA 통계")
	Mono<LatencyStats> getLatencyStats();

	@Operation(summary = "최근 지연 SLA 위반")
	Mono<List<LatencyAlert>> getLatencyViolations(
		@Parameter(description = "최대 개수") @Min(1) int limit
	);

	@Operation(
		summary = "지연 임계값 변경",
		description = "지정한 항목만 변경하며 진행 중인 모니터링에 즉시 반영됩니다"
	)
	@ApiResponse(responseCode = "200", description = "변경된 임계값")
	@ApiResponse(responseCode = "400", description = "0 이하 임계값")
	Mono<LatencyThresholds> updateLatencyThresholds(
		LatencyThresholdsUpdate update
	);

	@Operation(summary = "지연 경보 초기화")
	Mono<Void> clearLatencyAlerts();

	@Operation(summary = "세션 중단 통계")
	Mono<InterruptionStats> getInterruptionStats(
		@Parameter(description = "세션 ID") String sessionId
	);

	@Operation(summary = "서킷 브레이커 상태")
	Mono<Map<String, CircuitBreakerStatus>> getCircuitBreakers();

	@Operation(summary = "서킷 브레이커 전체 초기화")
	Mono<Map<String, CircuitBreakerStatus>> resetCircuitBreakers();

	@Operation(
		summary = "다운스트림 서비스 상태",
		description = "ASR, LLM, RAG, TTS 서비스의 헬스 엔드포인트를 확인합니다"
	)
	@ApiResponse(responseCode = "200", description = "모든 서비스 정상")
	@ApiResponse(responseCode = "503", description = "일부 서비스 비정상")
	Mono<ResponseEntity<HealthResponse>> health();
}

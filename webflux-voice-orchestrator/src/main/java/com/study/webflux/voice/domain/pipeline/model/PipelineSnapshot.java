package com.study.webflux.voice.domain.pipeline.model;

import java.util.List;

/**
 * 모니터링 API로 직렬화할 수 있는 파이프라인 상태 투영입니다.
 */
public record PipelineSnapshot(
	String id,
	String sessionId,
	String userId,
	PipelineStage stage,
	PipelineMetrics metrics,
	int transcriptLength,
	int responseLength,
	int historyLength,
	boolean hasRetrievalContext,
	boolean interrupted,
	String error,
	List<StageTransition> stageHistory
) {
}

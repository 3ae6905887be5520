package com.study.webflux.voice.domain.pipeline.model;

import java.time.Instant;

/**
 * 파이프라인 타이밍 지표의 불변 사본입니다. 지연 값은 밀리초이며 측정 전에는 null입니다.
 */
public record PipelineMetrics(
	Instant startTime,
	Long audioToAsrLatency,
	Long asrToLlmLatency,
	Long llmToTtsLatency,
	Long ttsToClientLatency,
	Long firstTokenLatency,
	Long totalLatency,
	int asrPartialCount,
	int llmTokenCount,
	int ttsChunkCount
) {
}

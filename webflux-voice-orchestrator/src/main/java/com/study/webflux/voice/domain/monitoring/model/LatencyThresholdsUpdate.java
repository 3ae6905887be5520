package com.study.webflux.voice.domain.monitoring.model;

/** 부분 임계값 변경 요청입니다. null 항목은 유지됩니다. */
public record LatencyThresholdsUpdate(
	Long firstToken,
	Long audioToAsr,
	Long asrToLlm,
	Long llmToTts,
	Long ttsToClient,
	Long endToEnd
) {
}

package com.study.webflux.voice.domain.monitoring.model;

/**
 * 단계별 지연 임계값(ms)입니다.
 */
public record LatencyThresholds(
	long firstToken,
	long audioToAsr,
	long asrToLlm,
	long llmToTts,
	long ttsToClient,
	long endToEnd
) {

	public LatencyThresholds {
		if (firstToken <= 0 || audioToAsr <= 0 || asrToLlm <= 0 || llmToTts <= 0
			|| ttsToClient <= 0 || endToEnd <= 0) {
			throw new IllegalArgumentException("latency thresholds must be positive");
		}
	}

	public static LatencyThresholds defaults() {
		return new LatencyThresholds(500, 50, 100, 50, 100, 2000);
	}

	/**
	 * 지정된 값만 교체한 새 임계값을 반환합니다.
	 */
	public LatencyThresholds merge(LatencyThresholdsUpdate update) {
		return new LatencyThresholds(
			update.firstToken() != null ? update.firstToken() : firstToken,
			update.audioToAsr() != null ? update.audioToAsr() : audioToAsr,
			update.asrToLlm() != null ? update.asrToLlm() : asrToLlm,
			update.llmToTts() != null ? update.llmToTts() : llmToTts,
			update.ttsToClient() != null ? update.ttsToClient() : ttsToClient,
			update.endToEnd() != null ? update.endToEnd() : endToEnd);
	}
}

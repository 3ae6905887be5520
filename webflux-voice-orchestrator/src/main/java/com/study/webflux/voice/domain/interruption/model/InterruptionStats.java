package com.study.webflux.voice.domain.interruption.model;

import java.util.List;
import java.util.Map;

public record InterruptionStats(
	int totalInterruptions,
	Map<String, Long> byTrigger,
	double averageConfidence,
	List<InterruptionEvent> recentEvents
) {
}

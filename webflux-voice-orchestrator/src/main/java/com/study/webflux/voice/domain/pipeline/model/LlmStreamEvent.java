package com.study.webflux.voice.domain.pipeline.model;

import java.util.List;
import java.util.Map;

/**
 * LLM 스트림에서 해석된 이벤트 하나입니다.
 *
 * <p>
 * 텍스트 델타는 {@code content}만 가지며, 종료 이벤트는 {@code done=true}와 함께 검색 출처/인용/그라운딩 메타데이터를
 * 전달합니다.
 */
public record LlmStreamEvent(
	String content,
	boolean done,
	List<Map<String, Object>> sources,
	List<String> citations,
	Map<String, Object> grounding
) {

	public LlmStreamEvent {
		sources = sources == null ? List.of() : sources;
		citations = citations == null ? List.of() : citations;
		grounding = grounding == null ? Map.of() : grounding;
	}

	public static LlmStreamEvent content(String content) {
		return new LlmStreamEvent(content, false, null, null, null);
	}

	public static LlmStreamEvent done(List<Map<String, Object>> sources, List<String> citations,
		Map<String, Object> grounding) {
		return new LlmStreamEvent(null, true, sources, citations, grounding);
	}

	public boolean hasContent() {
		return content != null && !content.isEmpty();
	}
}

package com.study.webflux.voice.domain.pipeline.model;

import java.util.List;
import java.util.Map;

/**
 * LLM 라우터가 응답 종료 시 전달한 검색 문서와 인용 정보입니다.
 */
public record RetrievalContext(
	List<Map<String, Object>> documents,
	List<String> citations
) {

	public RetrievalContext {
		documents = documents == null ? List.of() : List.copyOf(documents);
		citations = citations == null ? List.of() : List.copyOf(citations);
	}
}

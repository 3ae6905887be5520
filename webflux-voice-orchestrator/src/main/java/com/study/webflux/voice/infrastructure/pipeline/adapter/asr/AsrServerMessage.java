package com.study.webflux.voice.infrastructure.pipeline.adapter.asr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 음성 인식 게이트웨이가 보내는 JSON 프레임입니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record AsrServerMessage(
	String type,
	String transcript,
	@JsonProperty("isFinal") boolean isFinal,
	Double confidence,
	Long timestamp,
	String status,
	String sessionId,
	String message,
	String error
) {

	String errorMessage() {
		if (message != null) {
			return message;
		}
		return error != null ? error : "Unknown recognition error";
	}
}

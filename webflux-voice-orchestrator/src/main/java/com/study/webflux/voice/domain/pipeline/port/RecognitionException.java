package com.study.webflux.voice.domain.pipeline.port;

/**
 * 음성 인식 게이트웨이 연결 또는 오류 프레임으로 인한 실패입니다.
 */
public class RecognitionException extends RuntimeException {

	public RecognitionException(String message) {
		super(message);
	}

	public RecognitionException(String message, Throwable cause) {
		super(message, cause);
	}
}

package com.study.webflux.voice.domain.pipeline.port;

import com.study.webflux.voice.domain.pipeline.model.RecognitionRequest;
import reactor.core.publisher.Mono;

public interface SpeechRecognitionPort {

	/**
	 * 음성 인식 게이트웨이와 양방향 스트리밍 연결을 엽니다. 연결이 열리고 시작 제어 프레임이 전송 대기열에 들어가면 완료됩니다.
	 */
	Mono<RecognitionConnection> connect(RecognitionRequest request, RecognitionListener listener);
}

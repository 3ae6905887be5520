package com.study.webflux.voice.domain.pipeline.port;

import com.study.webflux.voice.domain.pipeline.model.RecognitionTranscript;

/**
 * 음성 인식 게이트웨이가 보낸 메시지를 수신합니다.
 */
public interface RecognitionListener {

	void onTranscript(RecognitionTranscript transcript);

	void onStatus(String status);

	void onError(Throwable error);

	void onClosed();
}

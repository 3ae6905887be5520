package com.study.webflux.voice.domain.pipeline.port;

/**
 * 열린 음성 인식 연결입니다.
 */
public interface RecognitionConnection {

	void sendAudio(byte[] audio);

	/** 종료 제어 프레임을 보낸 뒤 연결을 닫습니다. */
	void stop();

	void close();

	boolean isOpen();
}

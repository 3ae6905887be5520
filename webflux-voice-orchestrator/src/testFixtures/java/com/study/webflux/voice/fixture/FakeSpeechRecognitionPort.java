package com.study.webflux.voice.fixture;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import com.study.webflux.voice.domain.pipeline.model.RecognitionRequest;
import com.study.webflux.voice.domain.pipeline.model.RecognitionTranscript;
import com.study.webflux.voice.domain.pipeline.port.RecognitionConnection;
import com.study.webflux.voice.domain.pipeline.port.RecognitionListener;
import com.study.webflux.voice.domain.pipeline.port.SpeechRecognitionPort;
import reactor.core.publisher.Mono;

/**
 * 메모리 안에서 동작하는 음성 인식 포트입니다. 테스트가 리스너로 전사를 직접 밀어 넣습니다.
 */
public class FakeSpeechRecognitionPort implements SpeechRecognitionPort {

	private final List<RecognitionRequest> requests = new CopyOnWriteArrayList<>();
	private volatile RecognitionListener listener;
	private volatile FakeConnection connection;
	private volatile RuntimeException connectFailure;

	@Override
	public Mono<RecognitionConnection> connect(RecognitionRequest request,
		RecognitionListener listener) {
		return Mono.defer(() -> {
			requests.add(request);
			if (connectFailure != null) {
				return Mono.error(connectFailure);
			}
			this.listener = listener;
			this.connection = new FakeConnection();
			return Mono.just(connection);
		});
	}

	public void failConnectWith(RuntimeException failure) {
		this.connectFailure = failure;
	}

	public void partial(String text) {
		listener.onTranscript(new RecognitionTranscript(text, false, 0.5));
	}

	public void finalTranscript(String text) {
		listener.onTranscript(new RecognitionTranscript(text, true, 0.95));
	}

	public void error(Throwable error) {
		listener.onError(error);
	}

	public List<RecognitionRequest> getRequests() {
		return requests;
	}

	public FakeConnection getConnection() {
		return connection;
	}

	public static class FakeConnection implements RecognitionConnection {

		private final List<byte[]> audio = new CopyOnWriteArrayList<>();
		private final AtomicBoolean open = new AtomicBoolean(true);
		private final AtomicBoolean stopped = new AtomicBoolean();

		@Override
		public void sendAudio(byte[] chunk) {
			audio.add(chunk);
		}

		@Override
		public void stop() {
			stopped.set(true);
			close();
		}

		@Override
		public void close() {
			open.set(false);
		}

		@Override
		public boolean isOpen() {
			return open.get();
		}

		public List<byte[]> getAudio() {
			return audio;
		}

		public boolean isStopped() {
			return stopped.get();
		}
	}
}

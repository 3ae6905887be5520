package com.study.webflux.voice.infrastructure.pipeline.adapter.llm;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.voice.domain.pipeline.model.CompletionMessage;
import com.study.webflux.voice.domain.pipeline.model.CompletionRequest;
import com.study.webflux.voice.domain.pipeline.model.LlmStreamEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class LlmRouterStreamAdapterTest {

	private static final int TEST_PORT = 18081;
	private static final String BASE_URL = "http://localhost:" + TEST_PORT;

	private final AtomicReference<HttpStatus> responseStatus = new AtomicReference<>(HttpStatus.OK);
	private final AtomicReference<String> receivedBody = new AtomicReference<>();
	private DisposableServer server;
	private LlmRouterStreamAdapter adapter;

	@BeforeEach
	void setUp() {
		startFakeRouter();
		WebClient.Builder webClientBuilder = WebClient.builder()
			.clientConnector(new ReactorClientHttpConnector());
		adapter = new LlmRouterStreamAdapter(webClientBuilder, BASE_URL,
			new SseEventDecoder(new ObjectMapper()));
	}

	@AfterEach
	void tearDown() {
		if (server != null) {
			server.disposeNow();
		}
	}

	private void startFakeRouter() {
		RouterFunction<ServerResponse> routes = RouterFunctions.route()
			.POST("/complete/stream", request -> request.bodyToMono(String.class)
				.flatMap(body -> {
					receivedBody.set(body);
					if (responseStatus.get() != HttpStatus.OK) {
						return ServerResponse.status(responseStatus.get()).build();
					}
					return ServerResponse.ok()
						.contentType(MediaType.TEXT_EVENT_STREAM)
						.body(BodyInserters.fromDataBuffers(sseBody()));
				}))
			.build();
		HttpHandler httpHandler = RouterFunctions.toHttpHandler(routes);
		server = HttpServer.create().port(TEST_PORT)
			.handle(new ReactorHttpHandlerAdapter(httpHandler))
			.bindNow();
	}

	private static Flux<DataBuffer> sseBody() {
		DefaultDataBufferFactory factory = DefaultDataBufferFactory.sharedInstance;
		return Flux.just("data: {\"content\":\"Hi\"}\n",
			"data: {\"content\":\" the",
			"re\"}\n",
			"data: {\"done\":true,\"sources\":[{\"id\":\"doc-1\"}],\"citations\":[\"[1] doc-1\"]}\n")
			.map(chunk -> factory.wrap(chunk.getBytes(StandardCharsets.UTF_8)));
	}

	private static CompletionRequest request() {
		return new CompletionRequest(List.of(new CompletionMessage("user", "hello")), 0.7, 500);
	}

	@Test
	@DisplayName("스트리밍 응답을 이벤트로 해석한다")
	void openStream_decodesEvents() {
		Mono<List<LlmStreamEvent>> events = adapter.openStream(request())
			.flatMap(Flux::collectList);

		StepVerifier.create(events).assertNext(list -> {
			assertThat(list).extracting(LlmStreamEvent::content)
				.containsExactly("Hi", " there", null);
			LlmStreamEvent done = list.get(2);
			assertThat(done.done()).isTrue();
			assertThat(done.sources()).singleElement()
				.satisfies(source -> assertThat(source).containsEntry("id", "doc-1"));
			assertThat(done.citations()).containsExactly("[1] doc-1");
		}).verifyComplete();
	}

	@Test
	@DisplayName("대화 메시지와 생성 옵션을 JSON 본문으로 전송한다")
	void openStream_sendsCompletionRequest() {
		StepVerifier.create(adapter.openStream(request()).flatMap(Flux::count))
			.expectNext(3L)
			.verifyComplete();

		assertThat(receivedBody.get())
			.contains("\"messages\":[{\"role\":\"user\",\"content\":\"hello\"}]")
			.contains("\"temperature\":0.7")
			.contains("\"maxTokens\":500");
	}

	@Test
	@DisplayName("오류 상태 응답은 Mono 오류로 전달한다")
	void openStream_errorStatus_fails() {
		responseStatus.set(HttpStatus.SERVICE_UNAVAILABLE);

		StepVerifier.create(adapter.openStream(request()))
			.expectError(WebClientResponseException.ServiceUnavailable.class)
			.verify();
	}
}

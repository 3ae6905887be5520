package com.study.webflux.voice.infrastructure.pipeline.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 음성 파이프라인 설정입니다. 기본값은 {@code application.yml}과 동일합니다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "voice.pipeline")
public class VoicePipelineProperties {

	private Services services = new Services();
	private Duration requestTimeout = Duration.ofMillis(2000);
	private Duration healthCheckTimeout = Duration.ofMillis(2000);
	private Recognition recognition = new Recognition();
	private Llm llm = new Llm();
	private Tts tts = new Tts();
	private CircuitBreaker circuitBreaker = new CircuitBreaker();
	private Interruption interruption = new Interruption();
	private Latency latency = new Latency();

	@Getter
	@Setter
	public static class Services {
		private String asrGatewayUrl = "http://localhost:8001";
		private String llmRouterUrl = "http://localhost:8002";
		private String ragServiceUrl = "http://localhost:8003";
		private String ttsServiceUrl = "http://localhost:8004";
	}

	@Getter
	@Setter
	public static class Recognition {
		private String path = "/transcribe/stream";
		private String languageCode = "en-US";
		private int sampleRate = 16000;
		private Duration connectTimeout = Duration.ofSeconds(5);
	}

	@Getter
	@Setter
	public static class Llm {
		private double temperature = 0.7;
		private int maxTokens = 500;
		private int historyTurns = 5;
		private String fallbackMessage = "I'm currently experiencing technical difficulties. Please try again shortly.";
	}

	@Getter
	@Setter
	public static class Tts {
		private String defaultVoice = "default";
		private double defaultSpeed = 1.0;
	}

	@Getter
	@Setter
	public static class CircuitBreaker {
		private int failureThreshold = 5;
		private int successThreshold = 2;
		private Duration timeout = Duration.ofSeconds(30);
		private Duration rollingWindow = Duration.ofSeconds(60);
	}

	@Getter
	@Setter
	public static class Interruption {
		private double vadThreshold = 0.7;
		private Duration vadDuration = Duration.ofMillis(150);
		private Duration cooldown = Duration.ofMillis(1000);
	}

	@Getter
	@Setter
	public static class Latency {
		private long firstToken = 500;
		private long audioToAsr = 50;
		private long asrToLlm = 100;
		private long llmToTts = 50;
		private long ttsToClient = 100;
		private long endToEnd = 2000;
	}
}

package com.study.webflux.voice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VoiceOrchestratorApplication {

	public static void main(String[] args) {
		SpringApplication.run(VoiceOrchestratorApplication.class, args);
	}
}

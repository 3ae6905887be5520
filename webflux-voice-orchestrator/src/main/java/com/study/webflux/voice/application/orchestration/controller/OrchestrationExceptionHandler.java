package com.study.webflux.voice.application.orchestration.controller;

import java.time.Clock;
import java.time.Instant;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.study.webflux.voice.application.orchestration.service.PipelineNotFoundException;
import jakarta.validation.ConstraintViolationException;

/**
 * 오케스트레이션 API 경계의 예외를 HTTP 응답으로 변환합니다.
 */
@Slf4j
@RequiredArgsConstructor
@RestControllerAdvice(assignableTypes = OrchestrationController.class)
public class OrchestrationExceptionHandler {

	private final Clock clock;

	@ExceptionHandler(ConstraintViolationException.class)
	public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException ex) {
		log.debug("요청 파라미터 검증 실패: {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.BAD_REQUEST)
			.body(new ApiError("INVALID_PARAMETER", ex.getMessage(), clock.instant()));
	}

	@ExceptionHandler(PipelineNotFoundException.class)
	public ResponseEntity<ApiError> handlePipelineNotFound(PipelineNotFoundException ex) {
		log.debug("파이프라인 없음: {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.NOT_FOUND)
			.body(new ApiError("PIPELINE_NOT_FOUND", ex.getMessage(), clock.instant()));
	}

	public record ApiError(
		String errorCode,
		String message,
		Instant timestamp
	) {
	}
}

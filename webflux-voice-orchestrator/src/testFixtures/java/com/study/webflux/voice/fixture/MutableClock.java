package com.study.webflux.voice.fixture;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** 테스트에서 직접 앞으로 돌릴 수 있는 시계입니다. */
public final class MutableClock extends Clock {

	public static final Instant DEFAULT_START = Instant.parse("2024-12-21T12:00:00Z");

	private volatile Instant now;

	public MutableClock(Instant start) {
		this.now = start;
	}

	public static MutableClock create() {
		return new MutableClock(DEFAULT_START);
	}

	public void advance(Duration duration) {
		now = now.plus(duration);
	}

	public void advanceMillis(long millis) {
		advance(Duration.ofMillis(millis));
	}

	@Override
	public ZoneId getZone() {
		return ZoneOffset.UTC;
	}

	@Override
	public Clock withZone(ZoneId zone) {
		return this;
	}

	@Override
	public Instant instant() {
		return now;
	}
}

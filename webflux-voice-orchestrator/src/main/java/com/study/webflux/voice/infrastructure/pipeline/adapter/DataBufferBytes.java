package com.study.webflux.voice.infrastructure.pipeline.adapter;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;

public final class DataBufferBytes {

	private DataBufferBytes() {
	}

	/** 버퍼 내용을 복사하고 버퍼를 해제합니다. */
	public static byte[] toBytes(DataBuffer dataBuffer) {
		try {
			byte[] bytes = new byte[dataBuffer.readableByteCount()];
			dataBuffer.read(bytes);
			return bytes;
		} finally {
			DataBufferUtils.release(dataBuffer);
		}
	}
}

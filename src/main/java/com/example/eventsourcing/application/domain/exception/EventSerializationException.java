package com.example.eventsourcing.application.domain.exception;

/**
 * 事件或快照狀態 JSON 序列化/反序列化失敗
 */
public class EventSerializationException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public EventSerializationException(String message, Throwable cause) {
		super(message, cause);
	}
}

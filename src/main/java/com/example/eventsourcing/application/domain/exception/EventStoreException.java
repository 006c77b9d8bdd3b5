package com.example.eventsourcing.application.domain.exception;

/**
 * Event Store / Snapshot Store 的儲存層錯誤，發生時該批寫入已整批回滾
 */
public class EventStoreException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public EventStoreException(String message) {
		super(message);
	}

	public EventStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}

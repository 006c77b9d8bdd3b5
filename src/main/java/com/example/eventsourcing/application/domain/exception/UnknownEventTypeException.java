package com.example.eventsourcing.application.domain.exception;

import lombok.Getter;

/**
 * 遇到聚合根無法處理的事件類型。屬於程式或資料錯誤，不可略過。
 */
@Getter
public class UnknownEventTypeException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final String aggregateType;

	private final String eventType;

	public UnknownEventTypeException(String aggregateType, String eventType) {
		super("聚合根 " + aggregateType + " 無法處理事件類型: " + eventType);
		this.aggregateType = aggregateType;
		this.eventType = eventType;
	}
}

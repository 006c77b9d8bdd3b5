package com.example.eventsourcing.application.domain.event;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 領域事件 (Domain Event)
 * <p>
 * 事件本身即為 payload：實作類別的欄位會整包序列化成 JSON 存入 Event Store。 事件一旦產生即不可變。
 * </p>
 */
public interface DomainEvent {

	/**
	 * 事件類型名稱，預設為類別簡名，作為反序列化時對應 Java 類別的 key
	 */
	@JsonIgnore
	default String getEventType() {
		return getClass().getSimpleName();
	}

	String getAggregateId();

	/**
	 * 事件發生時間，重播時聚合根只能從這裡取得時間
	 */
	Instant getOccurredAt();

	/**
	 * 事件結構版本，事件欄位有不相容變更時由實作類別覆寫
	 */
	@JsonIgnore
	default int getSchemaVersion() {
		return 1;
	}
}

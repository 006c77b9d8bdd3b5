package com.example.eventsourcing.application.domain.event;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 已持久化的事件
 * <p>
 * {@code globalSequence} 由資料庫配發，跨聚合根全域遞增且唯一；{@code version} 為該聚合根事件流內的序號 (1..N)。
 * {@code eventData} 保留原始 JSON，由 Repository 依 {@code eventType} 轉回領域事件。
 * </p>
 */
@Getter
@Builder
@ToString(exclude = "eventData")
@AllArgsConstructor
public class StoredEvent {

	private final long globalSequence;

	private final String aggregateId;

	private final String aggregateType;

	private final String eventType;

	private final long version;

	private final int schemaVersion;

	private final String eventData;

	private final EventMetadata metadata;

	private final String idempotencyKey;

	private final Instant occurredAt;
}

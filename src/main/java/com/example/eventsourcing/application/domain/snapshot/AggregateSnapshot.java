package com.example.eventsourcing.application.domain.snapshot;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 聚合根快照
 * <p>
 * {@code version} 版本的快照狀態必須等於事件 1..version 依序 fold 的結果，載入時只需重播其後的事件。
 * 快照只是加速手段，遺失或過期都不影響正確性。
 * </p>
 */
@Getter
@Builder
@ToString(exclude = "state")
@AllArgsConstructor
public class AggregateSnapshot {

	private final String aggregateId;

	private final String aggregateType;

	private final long version;

	/**
	 * 狀態的 JSON 表示
	 */
	private final String state;

	private final Instant createdAt;
}

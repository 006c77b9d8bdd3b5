package com.example.eventsourcing.application.shared.dto;

import java.time.Instant;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 跨聚合根的全域事件查詢條件
 * <p>
 * 所有條件皆為選填，區間皆為閉區間，結果依 globalSequence 遞增排序。
 * </p>
 */
@Getter
@Builder
@ToString
public class GlobalQuery {

	private final String aggregateType;

	private final String eventType;

	private final Long fromSequence;

	private final Long toSequence;

	private final Instant fromTimestamp;

	private final Instant toTimestamp;

	private final Integer limit;

	public static GlobalQuery all() {
		return GlobalQuery.builder().build();
	}
}

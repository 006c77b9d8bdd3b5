package com.example.eventsourcing.application.shared.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 單一聚合根事件流查詢條件，版本區間為閉區間，未指定則不設限
 */
@Getter
@Builder
@ToString
public class StreamQuery {

	private final String aggregateId;

	private final Long fromVersion;

	private final Long toVersion;

	public static StreamQuery of(String aggregateId) {
		return StreamQuery.builder().aggregateId(aggregateId).build();
	}

	public static StreamQuery from(String aggregateId, long fromVersion) {
		return StreamQuery.builder().aggregateId(aggregateId).fromVersion(fromVersion).build();
	}
}

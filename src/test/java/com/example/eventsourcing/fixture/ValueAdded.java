package com.example.eventsourcing.fixture;

import java.time.Instant;

import com.example.eventsourcing.application.domain.event.DomainEvent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 計數器加上指定數量
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor
public class ValueAdded implements DomainEvent {

	public static final String TYPE = "ValueAdded";

	private String aggregateId;

	private Instant occurredAt;

	private long amount;
}

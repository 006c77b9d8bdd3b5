package com.example.eventsourcing.fixture;

import java.time.Instant;

import com.example.eventsourcing.application.domain.event.DomainEvent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 設定計數器為指定值
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor
public class ValueSet implements DomainEvent {

	public static final String TYPE = "ValueSet";

	private String aggregateId;

	private Instant occurredAt;

	private long value;
}

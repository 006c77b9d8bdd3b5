package com.example.eventsourcing.fixture;

import java.time.Instant;

import com.example.eventsourcing.application.domain.event.DomainEvent;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 計數器不認得的事件，用來驗證未知事件類型會被拒絕
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor
public class CounterRenamed implements DomainEvent {

	private String aggregateId;

	private Instant occurredAt;

	private String name;
}

package com.example.eventsourcing.fixture;

import java.time.Instant;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 計數器狀態 (不可變)
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor
public class CounterState {

	public static final CounterState ZERO = new CounterState(0L, null);

	private long value;

	private Instant lastChangedAt;
}

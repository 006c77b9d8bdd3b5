package com.example.eventsourcing.application.domain.aggregate;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 聚合根版本 (Value Object)
 * <p>
 * 代表聚合根事件流中最後一筆事件的序號，初始為 0，每套用一筆事件只會 +1，不可為負、不可回退。
 * </p>
 */
@Getter
@EqualsAndHashCode
public final class AggregateVersion implements Comparable<AggregateVersion> {

	private static final AggregateVersion INITIAL = new AggregateVersion(0);

	private final long value;

	private AggregateVersion(long value) {
		this.value = value;
	}

	/**
	 * 尚未套用任何事件的版本 (0)
	 */
	public static AggregateVersion initial() {
		return INITIAL;
	}

	/**
	 * @param value 版本值，不可為負數
	 * @throws IllegalArgumentException 版本為負數時
	 */
	public static AggregateVersion of(long value) {
		if (value < 0) {
			throw new IllegalArgumentException("聚合根版本不可為負數: " + value);
		}
		return value == 0 ? INITIAL : new AggregateVersion(value);
	}

	public AggregateVersion increment() {
		return new AggregateVersion(Math.addExact(value, 1));
	}

	public boolean isInitial() {
		return value == 0;
	}

	public boolean isGreaterThan(AggregateVersion other) {
		return value > other.value;
	}

	public boolean isLessThan(AggregateVersion other) {
		return value < other.value;
	}

	@Override
	public int compareTo(AggregateVersion other) {
		return Long.compare(value, other.value);
	}

	@Override
	public String toString() {
		return Long.toString(value);
	}
}

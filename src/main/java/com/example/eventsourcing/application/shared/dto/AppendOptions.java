package com.example.eventsourcing.application.shared.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 寫入事件時的參數
 */
@Getter
@Builder
@ToString
public class AppendOptions {

	/**
	 * 寫入前事件流應有的版本，新聚合根為 0
	 */
	private final long expectedVersion;

	/**
	 * 冪等鍵，相同的 key 只會寫入一次
	 */
	private final String idempotencyKey;

	private final String correlationId;

	private final String causationId;

	private final String userId;

	public static AppendOptions expectedVersion(long expectedVersion) {
		return AppendOptions.builder().expectedVersion(expectedVersion).build();
	}
}

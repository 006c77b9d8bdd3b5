package com.example.eventsourcing.application.domain.event;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 事件追蹤資訊，與事件一起以 JSON 存放
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class EventMetadata {

	/**
	 * 同一次業務操作產生的所有事件共用，未指定時以聚合根 ID 代替
	 */
	private String correlationId;

	/**
	 * 觸發此事件的上游事件或命令 ID
	 */
	private String causationId;

	private String userId;

	private Instant timestamp;
}

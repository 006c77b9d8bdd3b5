package com.example.eventsourcing.config.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * event-sourcing.* 設定
 */
@Data
@ConfigurationProperties(prefix = "event-sourcing")
public class EventSourcingProperties {

	private Snapshot snapshot = new Snapshot();

	private Subscription subscription = new Subscription();

	@Data
	public static class Snapshot {

		/**
		 * 版本每跨過此值的倍數即自動建立快照，0 代表關閉
		 */
		private int threshold = 100;

		/**
		 * 每個聚合根保留的快照份數
		 */
		private int retainCount = 2;

		private String retentionCron = "0 30 3 * * ?";
	}

	@Data
	public static class Subscription {

		private Duration pollInterval = Duration.ofSeconds(1);

		private int batchSize = 100;

		/**
		 * 同一筆事件投遞失敗達此次數後放棄並記錄 error
		 */
		private int maxDeliveryAttempts = 3;

		/**
		 * 序號缺口等待較早交易提交的時間上限，逾時視為回滾造成的空號
		 */
		private Duration gapTimeout = Duration.ofSeconds(5);
	}
}

package com.example.eventsourcing.iface.schedule;

import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.eventsourcing.application.port.SnapshotStorePort;
import com.example.eventsourcing.config.config.EventSourcingProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 舊快照定期清理任務
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotRetentionTask {

	private final SnapshotStorePort snapshotStore;

	private final EventSourcingProperties properties;

	/**
	 * 每個聚合根只保留最新的 retain-count 份快照 Cron 表達式：秒 分 時 日 月 週 (預設每天凌晨 3:30)
	 *
	 * @return 本次刪除的快照總數
	 */
	@Scheduled(cron = "${event-sourcing.snapshot.retention-cron:0 30 3 * * ?}")
	public int cleanupOldSnapshots() {
		int retainCount = properties.getSnapshot().getRetainCount();
		log.info(">>> [Cleanup] 開始清理舊快照，每個聚合根保留 {} 份...", retainCount);

		List<String> aggregateIds;
		try {
			aggregateIds = snapshotStore.findAggregatesExceeding(retainCount);
		} catch (RuntimeException e) {
			log.error(">>> [Cleanup] 查詢待清理聚合根失敗: {}", e.getMessage(), e);
			return 0;
		}

		int totalDeleted = 0;
		for (String aggregateId : aggregateIds) {
			try {
				totalDeleted += snapshotStore.cleanup(aggregateId, retainCount);
			} catch (RuntimeException e) {
				// 單一聚合根失敗不影響其餘聚合根
				log.error(">>> [Cleanup] 聚合根 {} 快照清理失敗: {}", aggregateId, e.getMessage(), e);
			}
		}

		log.info(">>> [Cleanup] 快照清理完成，{} 個聚合根共移除 {} 份快照", aggregateIds.size(), totalDeleted);
		return totalDeleted;
	}
}

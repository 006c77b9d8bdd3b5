package com.example.eventsourcing.application.port;

import java.util.List;
import java.util.Optional;

import com.example.eventsourcing.application.domain.snapshot.AggregateSnapshot;

/**
 * 聚合根快照儲存端口
 */
public interface SnapshotStorePort {

	/**
	 * 儲存快照，相同 (aggregateId, version) 重複寫入時忽略
	 */
	void save(AggregateSnapshot snapshot);

	/**
	 * 取得最新 (版本最大) 的快照
	 */
	Optional<AggregateSnapshot> load(String aggregateId, String aggregateType);

	/**
	 * 只保留版本最大的 {@code keepCount} 份快照，刪除其餘較舊的快照
	 *
	 * @return 刪除筆數
	 * @throws IllegalArgumentException keepCount 小於 1
	 */
	int cleanup(String aggregateId, int keepCount);

	/**
	 * 找出快照數量超過 {@code keepCount} 的聚合根 ID
	 */
	List<String> findAggregatesExceeding(int keepCount);
}

package com.example.eventsourcing.application.port;

import java.util.Optional;

import com.example.eventsourcing.application.domain.aggregate.EventSourcedAggregate;

/**
 * 事件溯源聚合根的 Repository 端口
 *
 * @param <T> 聚合根型別
 */
public interface EventSourcedRepositoryPort<T extends EventSourcedAggregate<?>> {

	/**
	 * 由快照 + 之後的事件重建聚合根，不存在時回傳 empty
	 */
	Optional<T> load(String aggregateId);

	/**
	 * 將未提交事件以樂觀鎖寫入，成功後清空緩衝區
	 */
	void save(T aggregate);

	/**
	 * 同 {@link #save(EventSourcedAggregate)}，以冪等鍵保證同一操作只寫入一次
	 */
	void save(T aggregate, String idempotencyKey);

	boolean exists(String aggregateId);

	/**
	 * 立即為聚合根目前狀態建立快照
	 */
	void snapshot(T aggregate);
}

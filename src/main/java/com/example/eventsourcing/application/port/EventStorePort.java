package com.example.eventsourcing.application.port;

import java.util.List;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.shared.dto.AppendOptions;
import com.example.eventsourcing.application.shared.dto.GlobalQuery;
import com.example.eventsourcing.application.shared.dto.StreamQuery;

/**
 * <h1>Event Store 端口</h1>
 * <p>
 * 只允許附加 (append-only) 的事件儲存，事件一經寫入不可修改或刪除。
 * </p>
 */
public interface EventStorePort {

	/**
	 * 以樂觀鎖將一批事件原子性地附加到聚合根事件流尾端。
	 * <p>
	 * 第 i 筆 (從 1 起算) 事件的版本為 {@code expectedVersion + i}。 若冪等鍵已寫入過，不寫入任何資料並回傳空集合。
	 * </p>
	 *
	 * @param aggregateId   聚合根 ID
	 * @param aggregateType 聚合根類型
	 * @param events        依產生順序排列的事件
	 * @param options       expectedVersion 與追蹤資訊
	 * @return 實際寫入的事件 (含 globalSequence)，冪等重送時為空集合
	 * @throws com.example.eventsourcing.application.domain.exception.ConcurrencyException 版本不符
	 * @throws com.example.eventsourcing.application.domain.exception.EventStoreException  其他儲存錯誤
	 */
	List<StoredEvent> append(String aggregateId, String aggregateType, List<? extends DomainEvent> events,
			AppendOptions options);

	/**
	 * 讀取單一聚合根的事件流，依版本遞增排序
	 */
	List<StoredEvent> loadStream(StreamQuery query);

	/**
	 * 跨聚合根查詢事件，依 globalSequence 遞增排序
	 */
	List<StoredEvent> queryEvents(GlobalQuery query);

	/**
	 * 訂閱 globalSequence 大於 {@code fromSequence} 的所有事件 (含之後新寫入的)。
	 * <p>
	 * 保證依序、至少一次投遞，handler 必須能承受重複事件。
	 * </p>
	 */
	EventSubscription subscribe(long fromSequence, StoredEventHandler handler);

	/**
	 * @return 目前已提交的最大 globalSequence，沒有事件時為 0
	 */
	long getCurrentSequence();

	/**
	 * @return 聚合根目前的版本，沒有事件時為 0
	 */
	long getCurrentVersion(String aggregateId);
}

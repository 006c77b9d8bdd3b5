package com.example.eventsourcing.infra.event.mapper;

import java.util.List;
import java.util.Map;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.UnknownEventTypeException;
import com.example.eventsourcing.infra.event.codec.EventJsonCodec;

/**
 * StoredEvent 與 Domain Event 之間的映射器
 *
 * <p>
 * 依 {@code eventType} 查表找到對應的 Java 類別，再交由 {@link EventJsonCodec} 還原事件內容。
 * 每個聚合根類型持有自己的一份事件類型表。
 * </p>
 *
 * <p>
 * 設計原則：
 * <ul>
 * <li>專責反序列化，不包含業務邏輯</li>
 * <li>查無事件類型時拋出 {@link UnknownEventTypeException}，不可略過任何事件</li>
 * </ul>
 * </p>
 */
public class StoredEventMapper {

	private final EventJsonCodec jsonCodec;

	private final String aggregateType;

	/**
	 * eventType → 事件類別
	 */
	private final Map<String, Class<? extends DomainEvent>> eventTypes;

	public StoredEventMapper(EventJsonCodec jsonCodec, String aggregateType,
			Map<String, Class<? extends DomainEvent>> eventTypes) {
		this.jsonCodec = jsonCodec;
		this.aggregateType = aggregateType;
		this.eventTypes = Map.copyOf(eventTypes);
	}

	/**
	 * 將 {@link StoredEvent} 還原為 Domain Event
	 *
	 * @param storedEvent 已持久化的事件
	 * @return 對應的 Domain Event
	 * @throws UnknownEventTypeException    事件類型未登記
	 * @throws com.example.eventsourcing.application.domain.exception.EventSerializationException 事件資料損毀
	 */
	public DomainEvent toDomainEvent(StoredEvent storedEvent) {
		Class<? extends DomainEvent> type = eventTypes.get(storedEvent.getEventType());
		if (type == null) {
			throw new UnknownEventTypeException(aggregateType, storedEvent.getEventType());
		}
		return jsonCodec.deserialize(storedEvent.getEventData(), type);
	}

	public List<DomainEvent> toDomainEvents(List<StoredEvent> storedEvents) {
		return storedEvents.stream().map(this::toDomainEvent).toList();
	}
}

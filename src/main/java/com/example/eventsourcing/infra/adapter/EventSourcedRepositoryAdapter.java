package com.example.eventsourcing.infra.adapter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.eventsourcing.application.domain.aggregate.AggregateVersion;
import com.example.eventsourcing.application.domain.aggregate.EventSourcedAggregate;
import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.EventSerializationException;
import com.example.eventsourcing.application.domain.exception.EventStoreException;
import com.example.eventsourcing.application.domain.snapshot.AggregateSnapshot;
import com.example.eventsourcing.application.port.EventSourcedRepositoryPort;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.SnapshotStorePort;
import com.example.eventsourcing.application.shared.dto.AppendOptions;
import com.example.eventsourcing.application.shared.dto.StreamQuery;
import com.example.eventsourcing.config.config.EventSourcingProperties;
import com.example.eventsourcing.infra.event.codec.EventJsonCodec;
import com.example.eventsourcing.infra.event.mapper.StoredEventMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>事件溯源聚合根倉儲轉接器 (Infrastructure Adapter)</h1>
 * <p>
 * 編排 Event Store 與 Snapshot Store 的協作，每種聚合根繼承一次並提供自己的型別資訊。
 * </p>
 *
 * <h2>載入策略：</h2>
 * <ul>
 * <li><b>快照優先</b>：有快照時從快照版本開始，只補齊之後的事件。</li>
 * <li><b>完整重播</b>：沒有快照，或快照狀態無法還原時，從版本 0 開始重播。</li>
 * </ul>
 *
 * <h2>儲存策略：</h2>
 * <ul>
 * <li>以 {@link EventSourcedAggregate#getVersionBeforeUncommitted()} 作為樂觀鎖版本。</li>
 * <li>版本跨過快照門檻的倍數時自動建立快照並清理舊快照，快照失敗不影響已提交的事件。</li>
 * </ul>
 *
 * @param <T> 聚合根型別
 * @param <S> 聚合根狀態型別
 */
@Slf4j
public abstract class EventSourcedRepositoryAdapter<T extends EventSourcedAggregate<S>, S>
		implements EventSourcedRepositoryPort<T> {

	private final EventStorePort eventStore;

	private final SnapshotStorePort snapshotStore;

	private final EventJsonCodec jsonCodec;

	private final EventSourcingProperties properties;

	private final String aggregateType;

	private final Class<S> stateType;

	private final StoredEventMapper eventMapper;

	protected EventSourcedRepositoryAdapter(EventStorePort eventStore, SnapshotStorePort snapshotStore,
			EventJsonCodec jsonCodec, EventSourcingProperties properties, String aggregateType, Class<S> stateType,
			Map<String, Class<? extends DomainEvent>> eventTypes) {
		this.eventStore = eventStore;
		this.snapshotStore = snapshotStore;
		this.jsonCodec = jsonCodec;
		this.properties = properties;
		this.aggregateType = aggregateType;
		this.stateType = stateType;
		this.eventMapper = new StoredEventMapper(jsonCodec, aggregateType, eventTypes);
	}

	/**
	 * 以指定的版本與狀態建立聚合根實例 (不含未提交事件)
	 */
	protected abstract T createAggregate(String aggregateId, AggregateVersion version, S state);

	/**
	 * 聚合根狀態的零值，即 state(0)
	 */
	protected abstract S initialState();

	public String getAggregateType() {
		return aggregateType;
	}

	@Override
	public Optional<T> load(String aggregateId) {
		T aggregate = restoreFromSnapshot(aggregateId)
				.orElseGet(() -> createAggregate(aggregateId, AggregateVersion.initial(), initialState()));
		long snapshotVersion = aggregate.getVersion().getValue();

		List<StoredEvent> storedEvents = eventStore.loadStream(StreamQuery.from(aggregateId, snapshotVersion + 1));
		if (snapshotVersion == 0 && storedEvents.isEmpty()) {
			return Optional.empty();
		}

		aggregate.replayEvents(eventMapper.toDomainEvents(storedEvents));

		// 事件流必須連續，重播後的版本應等於最後一筆事件的版本
		if (!storedEvents.isEmpty()) {
			long lastVersion = storedEvents.get(storedEvents.size() - 1).getVersion();
			if (aggregate.getVersion().getValue() != lastVersion) {
				throw new EventStoreException(String.format("聚合根 %s[%s] 事件流不連續: 重播後版本 %s，最後事件版本 %d",
						aggregateType, aggregateId, aggregate.getVersion(), lastVersion));
			}
		}

		log.debug(">>> [Recovery] 聚合根 {}[{}] 載入完成: 快照版本 {}，補齊 {} 筆事件，目前版本 {}", aggregateType, aggregateId,
				snapshotVersion, storedEvents.size(), aggregate.getVersion());
		return Optional.of(aggregate);
	}

	/**
	 * 快照遺失或無法還原都不是錯誤，回傳 empty 改走完整重播
	 */
	private Optional<T> restoreFromSnapshot(String aggregateId) {
		Optional<AggregateSnapshot> snapshotOpt = snapshotStore.load(aggregateId, aggregateType);
		if (snapshotOpt.isEmpty()) {
			return Optional.empty();
		}

		AggregateSnapshot snapshot = snapshotOpt.get();
		try {
			S state = jsonCodec.deserialize(snapshot.getState(), stateType);
			log.debug(">>> [Recovery] 發現快照！聚合根 {}[{}] 從版本 {} 開始補齊後續事件", aggregateType, aggregateId,
					snapshot.getVersion());
			return Optional.of(createAggregate(aggregateId, AggregateVersion.of(snapshot.getVersion()), state));
		} catch (EventSerializationException e) {
			log.warn(">>> [Recovery] 聚合根 {}[{}] 版本 {} 的快照無法還原，改為完整重播: {}", aggregateType, aggregateId,
					snapshot.getVersion(), e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void save(T aggregate) {
		save(aggregate, null);
	}

	@Override
	public void save(T aggregate, String idempotencyKey) {
		if (!aggregate.hasUncommittedEvents()) {
			return;
		}

		long expectedVersion = aggregate.getVersionBeforeUncommitted();
		List<DomainEvent> pending = aggregate.getUncommittedEvents();
		AppendOptions options = AppendOptions.builder().expectedVersion(expectedVersion).idempotencyKey(idempotencyKey)
				.build();

		// ConcurrencyException 直接往上拋，緩衝區保留給呼叫端判斷
		List<StoredEvent> stored = eventStore.append(aggregate.getId(), aggregateType, pending, options);
		if (stored.isEmpty()) {
			log.warn(">>> [Repository] 聚合根 {}[{}] 冪等鍵 {} 已處理過，捨棄 {} 筆未提交事件", aggregateType, aggregate.getId(),
					idempotencyKey, pending.size());
		}
		aggregate.clearUncommittedEvents();

		if (!stored.isEmpty()) {
			snapshotIfThresholdCrossed(aggregate, expectedVersion);
		}
	}

	private void snapshotIfThresholdCrossed(T aggregate, long previousVersion) {
		int threshold = properties.getSnapshot().getThreshold();
		if (threshold <= 0) {
			return;
		}

		long newVersion = aggregate.getVersion().getValue();
		if (newVersion / threshold <= previousVersion / threshold) {
			return;
		}

		try {
			snapshot(aggregate);
			snapshotStore.cleanup(aggregate.getId(), properties.getSnapshot().getRetainCount());
		} catch (RuntimeException e) {
			// 事件已提交，快照失敗只影響載入速度
			log.error(">>> [Snapshot] 聚合根 {}[{}] 自動快照失敗 (版本 {}): {}", aggregateType, aggregate.getId(),
					newVersion, e.getMessage(), e);
		}
	}

	@Override
	public void snapshot(T aggregate) {
		if (aggregate.hasUncommittedEvents()) {
			throw new IllegalStateException(
					"聚合根 " + aggregateType + "[" + aggregate.getId() + "] 仍有未提交事件，不可建立快照");
		}

		AggregateSnapshot snapshot = AggregateSnapshot.builder().aggregateId(aggregate.getId())
				.aggregateType(aggregateType).version(aggregate.getVersion().getValue())
				.state(jsonCodec.serialize(aggregate.getState())).createdAt(Instant.now()).build();
		snapshotStore.save(snapshot);
		log.info(">>> [Snapshot] 聚合根 {}[{}] 已建立快照，版本 {}", aggregateType, aggregate.getId(),
				aggregate.getVersion());
	}

	@Override
	public boolean exists(String aggregateId) {
		return eventStore.getCurrentVersion(aggregateId) > 0;
	}
}

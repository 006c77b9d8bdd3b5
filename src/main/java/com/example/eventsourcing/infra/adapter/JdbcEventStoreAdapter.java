package com.example.eventsourcing.infra.adapter;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.EventMetadata;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.ConcurrencyException;
import com.example.eventsourcing.application.domain.exception.EventStoreException;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.EventSubscription;
import com.example.eventsourcing.application.port.StoredEventHandler;
import com.example.eventsourcing.application.shared.dto.AppendOptions;
import com.example.eventsourcing.application.shared.dto.GlobalQuery;
import com.example.eventsourcing.application.shared.dto.StreamQuery;
import com.example.eventsourcing.config.config.EventSourcingProperties;
import com.example.eventsourcing.infra.event.codec.EventJsonCodec;
import com.example.eventsourcing.infra.subscription.PollingEventSubscription;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>關聯式資料庫 Event Store 適配器</h1>
 * <p>
 * 以 {@code domain_events} 表實作只允許附加的事件儲存。
 * </p>
 *
 * <h2>一致性保證：</h2>
 * <ul>
 * <li><b>樂觀鎖</b>：交易內先比對目前版本與 expectedVersion，不符即拋出 {@link ConcurrencyException}。</li>
 * <li><b>競態防線</b>：兩個寫入者同時通過版本比對時，由 {@code (aggregate_id, version)} 唯一鍵擋下後到者，
 * 整批回滾後再判斷為冪等重送或版本衝突。</li>
 * <li><b>冪等</b>：冪等鍵記錄在該批第一筆事件上，同一個 key 重送時回傳空集合。</li>
 * <li><b>全域序號</b>：由資料庫自增主鍵配發，跨聚合根嚴格遞增。</li>
 * </ul>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcEventStoreAdapter implements EventStorePort {

	private static final String SELECT_COLUMNS = """
			SELECT global_sequence, aggregate_id, aggregate_type, event_type, event_data, metadata,
			       version, schema_version, occurred_at, idempotency_key
			FROM domain_events
			""";

	private static final String INSERT_SQL = """
			INSERT INTO domain_events (aggregate_id, aggregate_type, event_type, event_data, metadata,
			                           version, schema_version, occurred_at, idempotency_key)
			VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
			""";

	private final JdbcTemplate jdbcTemplate;

	private final TransactionTemplate transactionTemplate;

	private final EventJsonCodec jsonCodec;

	private final EventSourcingProperties properties;

	/**
	 * 尚未取消的訂閱，停機時統一關閉
	 */
	private final Map<String, EventSubscription> subscriptions = new ConcurrentHashMap<>();

	@Override
	public List<StoredEvent> append(String aggregateId, String aggregateType, List<? extends DomainEvent> events,
			AppendOptions options) {
		if (events.isEmpty()) {
			return List.of();
		}
		validate(aggregateId, events);

		try {
			return transactionTemplate.execute(status -> doAppend(aggregateId, aggregateType, events, options));
		} catch (DuplicateKeyException | ConcurrencyFailureException e) {
			// 唯一鍵或鎖衝突：整批已回滾，於交易外重新判斷原因
			return resolveConflict(aggregateId, aggregateType, options, e);
		} catch (DataAccessException | TransactionException e) {
			throw new EventStoreException("聚合根 " + aggregateType + "[" + aggregateId + "] 事件寫入失敗", e);
		}
	}

	private List<StoredEvent> doAppend(String aggregateId, String aggregateType, List<? extends DomainEvent> events,
			AppendOptions options) {
		String idempotencyKey = options.getIdempotencyKey();

		// 1. 冪等檢查必須在版本比對之前，重送的請求 expectedVersion 必然已過期
		if (idempotencyKey != null && idempotencyKeyExists(idempotencyKey)) {
			log.warn(">>> [EventStore] 冪等鍵 {} 已寫入過，略過聚合根 {}[{}] 的 {} 筆事件", idempotencyKey, aggregateType,
					aggregateId, events.size());
			return List.of();
		}

		// 2. 樂觀鎖比對
		long currentVersion = getCurrentVersion(aggregateId);
		if (currentVersion != options.getExpectedVersion()) {
			log.warn(">>> [EventStore] 聚合根 {}[{}] 版本衝突: expected={}, actual={}", aggregateType, aggregateId,
					options.getExpectedVersion(), currentVersion);
			throw new ConcurrencyException(aggregateType, aggregateId, options.getExpectedVersion(), currentVersion);
		}

		// 3. 依序寫入，版本 = expectedVersion + i
		List<StoredEvent> stored = new ArrayList<>(events.size());
		for (int i = 0; i < events.size(); i++) {
			DomainEvent event = events.get(i);
			long version = options.getExpectedVersion() + i + 1;
			String key = i == 0 ? idempotencyKey : null;
			stored.add(insert(aggregateId, aggregateType, event, version, key, options));
		}

		log.debug(">>> [EventStore] 聚合根 {}[{}] 寫入 {} 筆事件，版本 {} → {}", aggregateType, aggregateId, stored.size(),
				options.getExpectedVersion(), options.getExpectedVersion() + stored.size());
		return stored;
	}

	private StoredEvent insert(String aggregateId, String aggregateType, DomainEvent event, long version,
			String idempotencyKey, AppendOptions options) {
		Instant occurredAt = event.getOccurredAt().truncatedTo(ChronoUnit.MICROS);
		EventMetadata metadata = EventMetadata.builder()
				.correlationId(options.getCorrelationId() != null ? options.getCorrelationId() : aggregateId)
				.causationId(options.getCausationId()).userId(options.getUserId()).timestamp(occurredAt).build();
		String eventData = jsonCodec.serialize(event);
		String metadataJson = jsonCodec.serialize(metadata);

		KeyHolder keyHolder = new GeneratedKeyHolder();
		jdbcTemplate.update(con -> {
			PreparedStatement ps = con.prepareStatement(INSERT_SQL, new String[] { "GLOBAL_SEQUENCE" });
			ps.setString(1, aggregateId);
			ps.setString(2, aggregateType);
			ps.setString(3, event.getEventType());
			ps.setString(4, eventData);
			ps.setString(5, metadataJson);
			ps.setLong(6, version);
			ps.setInt(7, event.getSchemaVersion());
			ps.setTimestamp(8, Timestamp.from(occurredAt));
			ps.setString(9, idempotencyKey);
			return ps;
		}, keyHolder);

		Number key = keyHolder.getKey();
		if (key == null) {
			throw new EventStoreException("資料庫未回傳 global_sequence: " + aggregateType + "[" + aggregateId + "]");
		}

		return StoredEvent.builder().globalSequence(key.longValue()).aggregateId(aggregateId)
				.aggregateType(aggregateType).eventType(event.getEventType()).version(version)
				.schemaVersion(event.getSchemaVersion()).eventData(eventData).metadata(metadata)
				.idempotencyKey(idempotencyKey).occurredAt(occurredAt).build();
	}

	/**
	 * 唯一鍵 (版本或冪等鍵) 被並行寫入者佔用。冪等鍵已存在代表同一操作已完成，否則一律視為版本衝突；
	 * 對方交易可能尚未提交，因此讀到的 actualVersion 可能仍等於 expectedVersion。
	 */
	private List<StoredEvent> resolveConflict(String aggregateId, String aggregateType, AppendOptions options,
			DataAccessException cause) {
		String idempotencyKey = options.getIdempotencyKey();
		long actualVersion;
		try {
			if (idempotencyKey != null && idempotencyKeyExists(idempotencyKey)) {
				log.warn(">>> [EventStore] 冪等鍵 {} 已由並行請求寫入，聚合根 {}[{}] 本次不寫入", idempotencyKey, aggregateType,
						aggregateId);
				return List.of();
			}
			actualVersion = getCurrentVersion(aggregateId);
		} catch (RuntimeException e) {
			e.addSuppressed(cause);
			throw new EventStoreException("聚合根 " + aggregateType + "[" + aggregateId + "] 寫入衝突後重新讀取失敗", e);
		}

		log.warn(">>> [EventStore] 聚合根 {}[{}] 並行寫入衝突: expected={}, actual={}, cause={}", aggregateType,
				aggregateId, options.getExpectedVersion(), actualVersion, cause.getMessage());
		throw new ConcurrencyException(aggregateType, aggregateId, options.getExpectedVersion(), actualVersion, cause);
	}

	private boolean idempotencyKeyExists(String idempotencyKey) {
		Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM domain_events WHERE idempotency_key = ?",
				Integer.class, idempotencyKey);
		return count != null && count > 0;
	}

	private void validate(String aggregateId, List<? extends DomainEvent> events) {
		for (DomainEvent event : events) {
			if (event.getOccurredAt() == null) {
				throw new IllegalArgumentException("事件 " + event.getEventType() + " 缺少 occurredAt");
			}
			if (!aggregateId.equals(event.getAggregateId())) {
				throw new IllegalArgumentException(
						"事件 " + event.getEventType() + " 屬於聚合根 " + event.getAggregateId() + "，不可寫入 " + aggregateId);
			}
		}
	}

	@Override
	public List<StoredEvent> loadStream(StreamQuery query) {
		StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE aggregate_id = ?");
		List<Object> args = new ArrayList<>();
		args.add(query.getAggregateId());

		if (query.getFromVersion() != null) {
			sql.append(" AND version >= ?");
			args.add(query.getFromVersion());
		}
		if (query.getToVersion() != null) {
			sql.append(" AND version <= ?");
			args.add(query.getToVersion());
		}
		sql.append(" ORDER BY version ASC");

		try {
			List<StoredEvent> events = jdbcTemplate.query(sql.toString(), storedEventRowMapper(), args.toArray());
			log.debug(">>> [EventStore] 讀取聚合根 {} 事件流 {} 筆", query.getAggregateId(), events.size());
			return events;
		} catch (DataAccessException e) {
			throw new EventStoreException("讀取聚合根 " + query.getAggregateId() + " 事件流失敗", e);
		}
	}

	@Override
	public List<StoredEvent> queryEvents(GlobalQuery query) {
		StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE 1 = 1");
		List<Object> args = new ArrayList<>();

		if (query.getAggregateType() != null) {
			sql.append(" AND aggregate_type = ?");
			args.add(query.getAggregateType());
		}
		if (query.getEventType() != null) {
			sql.append(" AND event_type = ?");
			args.add(query.getEventType());
		}
		if (query.getFromSequence() != null) {
			sql.append(" AND global_sequence >= ?");
			args.add(query.getFromSequence());
		}
		if (query.getToSequence() != null) {
			sql.append(" AND global_sequence <= ?");
			args.add(query.getToSequence());
		}
		if (query.getFromTimestamp() != null) {
			sql.append(" AND occurred_at >= ?");
			args.add(Timestamp.from(query.getFromTimestamp()));
		}
		if (query.getToTimestamp() != null) {
			sql.append(" AND occurred_at <= ?");
			args.add(Timestamp.from(query.getToTimestamp()));
		}
		sql.append(" ORDER BY global_sequence ASC");
		if (query.getLimit() != null) {
			sql.append(" LIMIT ?");
			args.add(query.getLimit());
		}

		try {
			return jdbcTemplate.query(sql.toString(), storedEventRowMapper(), args.toArray());
		} catch (DataAccessException e) {
			throw new EventStoreException("查詢事件失敗: " + query, e);
		}
	}

	@Override
	public EventSubscription subscribe(long fromSequence, StoredEventHandler handler) {
		EventSourcingProperties.Subscription config = properties.getSubscription();
		String id = UUID.randomUUID().toString();

		PollingEventSubscription subscription = new PollingEventSubscription(id, fromSequence, handler,
				position -> queryEvents(
						GlobalQuery.builder().fromSequence(position + 1).limit(config.getBatchSize()).build()),
				config, closed -> subscriptions.remove(closed.getId()));

		subscriptions.put(id, subscription);
		subscription.start();
		return subscription;
	}

	@Override
	public long getCurrentSequence() {
		try {
			Long sequence = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(global_sequence), 0) FROM domain_events",
					Long.class);
			return sequence != null ? sequence : 0L;
		} catch (DataAccessException e) {
			throw new EventStoreException("讀取目前全域序號失敗", e);
		}
	}

	@Override
	public long getCurrentVersion(String aggregateId) {
		try {
			Long version = jdbcTemplate.queryForObject(
					"SELECT COALESCE(MAX(version), 0) FROM domain_events WHERE aggregate_id = ?", Long.class,
					aggregateId);
			return version != null ? version : 0L;
		} catch (DataAccessException e) {
			throw new EventStoreException("讀取聚合根 " + aggregateId + " 目前版本失敗", e);
		}
	}

	/**
	 * 停機時關閉所有訂閱
	 */
	@PreDestroy
	public void closeSubscriptions() {
		if (subscriptions.isEmpty()) {
			return;
		}
		log.info(">>> [System] 關閉 {} 個事件訂閱...", subscriptions.size());
		List.copyOf(subscriptions.values()).forEach(EventSubscription::unsubscribe);
	}

	private RowMapper<StoredEvent> storedEventRowMapper() {
		return (rs, rowNum) -> StoredEvent.builder().globalSequence(rs.getLong("global_sequence"))
				.aggregateId(rs.getString("aggregate_id")).aggregateType(rs.getString("aggregate_type"))
				.eventType(rs.getString("event_type")).version(rs.getLong("version"))
				.schemaVersion(rs.getInt("schema_version")).eventData(rs.getString("event_data"))
				.metadata(readMetadata(rs)).idempotencyKey(rs.getString("idempotency_key"))
				.occurredAt(rs.getTimestamp("occurred_at").toInstant()).build();
	}

	private EventMetadata readMetadata(ResultSet rs) throws SQLException {
		String json = rs.getString("metadata");
		return json != null ? jsonCodec.deserialize(json, EventMetadata.class) : null;
	}
}

package com.example.eventsourcing.infra.adapter;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.eventsourcing.application.domain.exception.EventStoreException;
import com.example.eventsourcing.application.domain.snapshot.AggregateSnapshot;
import com.example.eventsourcing.application.port.SnapshotStorePort;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSnapshotStoreAdapter implements SnapshotStorePort {

	private final JdbcTemplate jdbcTemplate;

	@Override
	public void save(AggregateSnapshot snapshot) {
		String sql = """
				INSERT INTO aggregate_snapshots (aggregate_id, aggregate_type, version, state, created_at)
				VALUES (?, ?, ?, ?, ?)
				""";

		Instant createdAt = snapshot.getCreatedAt() != null ? snapshot.getCreatedAt() : Instant.now();
		try {
			jdbcTemplate.update(sql, snapshot.getAggregateId(), snapshot.getAggregateType(), snapshot.getVersion(),
					snapshot.getState(), Timestamp.from(createdAt.truncatedTo(ChronoUnit.MICROS)));
			log.debug(">>> [Snapshot] 快照已存入: {}[{}], Version={}", snapshot.getAggregateType(),
					snapshot.getAggregateId(), snapshot.getVersion());
		} catch (DuplicateKeyException e) {
			// 同版本快照內容必然相同，重複寫入直接忽略
			log.warn(">>> [Snapshot] 快照已存在，略過: {}[{}], Version={}", snapshot.getAggregateType(),
					snapshot.getAggregateId(), snapshot.getVersion());
		} catch (DataAccessException e) {
			throw new EventStoreException("快照寫入失敗: " + snapshot.getAggregateId(), e);
		}
	}

	@Override
	public Optional<AggregateSnapshot> load(String aggregateId, String aggregateType) {
		String sql = """
				SELECT aggregate_id, aggregate_type, version, state, created_at
				FROM aggregate_snapshots
				WHERE aggregate_id = ? AND aggregate_type = ?
				ORDER BY version DESC
				LIMIT 1
				""";

		try {
			AggregateSnapshot snapshot = jdbcTemplate.<AggregateSnapshot>queryForObject(sql,
					(rs, rowNum) -> AggregateSnapshot.builder().aggregateId(rs.getString("aggregate_id"))
							.aggregateType(rs.getString("aggregate_type")).version(rs.getLong("version"))
							.state(rs.getString("state")).createdAt(rs.getTimestamp("created_at").toInstant())
							.build(),
					aggregateId, aggregateType);
			return Optional.ofNullable(snapshot);
		} catch (EmptyResultDataAccessException e) {
			// 尚未建立過快照
			return Optional.empty();
		} catch (DataAccessException e) {
			throw new EventStoreException("快照讀取失敗: " + aggregateId, e);
		}
	}

	@Override
	public int cleanup(String aggregateId, int keepCount) {
		if (keepCount < 1) {
			throw new IllegalArgumentException("keepCount 至少為 1: " + keepCount);
		}

		try {
			List<Long> versions = jdbcTemplate.queryForList(
					"SELECT version FROM aggregate_snapshots WHERE aggregate_id = ? ORDER BY version DESC", Long.class,
					aggregateId);
			if (versions.size() <= keepCount) {
				return 0;
			}

			// 保留的最舊版本，比它更舊的全部刪除
			long oldestKept = versions.get(keepCount - 1);
			int deleted = jdbcTemplate.update("DELETE FROM aggregate_snapshots WHERE aggregate_id = ? AND version < ?",
					aggregateId, oldestKept);
			log.info(">>> [Snapshot] 聚合根 {} 清理舊快照 {} 份，保留版本 >= {}", aggregateId, deleted, oldestKept);
			return deleted;
		} catch (DataAccessException e) {
			throw new EventStoreException("快照清理失敗: " + aggregateId, e);
		}
	}

	@Override
	public List<String> findAggregatesExceeding(int keepCount) {
		String sql = """
				SELECT aggregate_id
				FROM aggregate_snapshots
				GROUP BY aggregate_id
				HAVING COUNT(*) > ?
				""";

		try {
			return jdbcTemplate.queryForList(sql, String.class, keepCount);
		} catch (DataAccessException e) {
			throw new EventStoreException("查詢待清理快照失敗", e);
		}
	}
}

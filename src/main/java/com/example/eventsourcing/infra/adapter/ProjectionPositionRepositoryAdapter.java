package com.example.eventsourcing.infra.adapter;

import java.sql.Timestamp;
import java.time.Instant;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.eventsourcing.application.domain.exception.EventStoreException;
import com.example.eventsourcing.application.port.ProjectionPositionRepositoryPort;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 投影進度 (Checkpoint) 存取，{@code projection_positions} 表
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ProjectionPositionRepositoryAdapter implements ProjectionPositionRepositoryPort {

	private static final String ADVANCE_SQL = """
			UPDATE projection_positions
			SET last_processed_sequence = ?, updated_at = ?
			WHERE projection_name = ? AND last_processed_sequence < ?
			""";

	private final JdbcTemplate jdbcTemplate;

	@Override
	public long getPosition(String projectionName) {
		try {
			Long position = jdbcTemplate.queryForObject(
					"SELECT last_processed_sequence FROM projection_positions WHERE projection_name = ?", Long.class,
					projectionName);
			return position != null ? position : 0L;
		} catch (EmptyResultDataAccessException e) {
			return 0L;
		} catch (DataAccessException e) {
			throw new EventStoreException("讀取投影進度失敗: " + projectionName, e);
		}
	}

	@Override
	public void savePosition(String projectionName, long sequence) {
		Timestamp now = Timestamp.from(Instant.now());
		try {
			if (advance(projectionName, sequence, now) > 0 || existsPosition(projectionName)) {
				return;
			}
			insertPosition(projectionName, sequence, now);
		} catch (DataAccessException e) {
			throw new EventStoreException("儲存投影進度失敗: " + projectionName, e);
		}
	}

	/**
	 * 只往前推進，舊位置不會覆蓋新位置
	 */
	private int advance(String projectionName, long sequence, Timestamp now) {
		return jdbcTemplate.update(ADVANCE_SQL, sequence, now, projectionName, sequence);
	}

	private void insertPosition(String projectionName, long sequence, Timestamp now) {
		try {
			jdbcTemplate.update("""
					INSERT INTO projection_positions (projection_name, last_processed_sequence, updated_at)
					VALUES (?, ?, ?)
					""", projectionName, sequence, now);
			log.debug(">>> [Checkpoint] 建立投影 {} 進度: {}", projectionName, sequence);
		} catch (DuplicateKeyException e) {
			// 並行建立，以對方寫入的為準後再推進一次
			log.debug(">>> [Checkpoint] 投影 {} 進度已由其他執行緒建立", projectionName);
			advance(projectionName, sequence, now);
		}
	}

	private boolean existsPosition(String projectionName) {
		Integer count = jdbcTemplate.queryForObject(
				"SELECT COUNT(*) FROM projection_positions WHERE projection_name = ?", Integer.class, projectionName);
		return count != null && count > 0;
	}
}

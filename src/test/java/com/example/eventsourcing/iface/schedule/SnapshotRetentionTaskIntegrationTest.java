package com.example.eventsourcing.iface.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import com.example.eventsourcing.application.domain.snapshot.AggregateSnapshot;
import com.example.eventsourcing.application.port.SnapshotStorePort;
import com.example.eventsourcing.fixture.Counter;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootTest
@ActiveProfiles("test")
class SnapshotRetentionTaskIntegrationTest {

	@Autowired
	private SnapshotRetentionTask retentionTask;

	@Autowired
	private SnapshotStorePort snapshotStore;

	@Autowired
	private JdbcTemplate jdbcTemplate;

	@BeforeEach
	void setUp() {
		jdbcTemplate.update("DELETE FROM aggregate_snapshots");
	}

	@Test
	@DisplayName("每個聚合根只保留最新 2 份快照，未超量的聚合根不受影響")
	void keepsLatestSnapshotsPerAggregate() {
		// --- Given ---
		for (long version = 1; version <= 4; version++) {
			save("c1", version);
		}
		save("c2", 3);
		save("c2", 6);

		// --- When ---
		int deleted = retentionTask.cleanupOldSnapshots();

		// --- Then ---
		log.info(">>> [Then] 共刪除 {} 份快照", deleted);
		assertThat(deleted).isEqualTo(2);
		assertThat(jdbcTemplate.queryForList("SELECT version FROM aggregate_snapshots WHERE aggregate_id = 'c1' ORDER BY version",
				Long.class)).containsExactly(3L, 4L);
		assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM aggregate_snapshots WHERE aggregate_id = 'c2'",
				Integer.class)).isEqualTo(2);
	}

	private void save(String aggregateId, long version) {
		snapshotStore.save(AggregateSnapshot.builder().aggregateId(aggregateId).aggregateType(Counter.TYPE)
				.version(version).state("{\"value\":" + version + "}").createdAt(Instant.now()).build());
	}
}

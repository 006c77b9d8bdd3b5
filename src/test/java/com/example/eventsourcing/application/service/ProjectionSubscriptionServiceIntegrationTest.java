package com.example.eventsourcing.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.EventSubscription;
import com.example.eventsourcing.application.port.ProjectionPositionRepositoryPort;
import com.example.eventsourcing.application.shared.dto.AppendOptions;
import com.example.eventsourcing.fixture.Counter;
import com.example.eventsourcing.fixture.ValueAdded;
import com.example.eventsourcing.fixture.ValueSet;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>斷點續傳訂閱整合測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 投影處理部分事件後停止，重新訂閱時從 checkpoint 接續。
 * </pre>
 */
@Slf4j
@SpringBootTest
@ActiveProfiles("test")
class ProjectionSubscriptionServiceIntegrationTest {

	private static final String PROJECTION = "counter_totals";

	private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

	@Autowired
	private ProjectionSubscriptionService subscriptionService;

	@Autowired
	private ProjectionPositionRepositoryPort positionRepository;

	@Autowired
	private EventStorePort eventStore;

	@Autowired
	private JdbcTemplate jdbcTemplate;

	private EventSubscription subscription;

	@BeforeEach
	void setUp() {
		log.info(">>> [Test Setup] 清理事件與投影進度...");
		jdbcTemplate.update("DELETE FROM domain_events");
		jdbcTemplate.update("DELETE FROM projection_positions");
	}

	@AfterEach
	void tearDown() {
		if (subscription != null) {
			subscription.unsubscribe();
		}
	}

	@Test
	@DisplayName("處理成功後推進 checkpoint，重新訂閱時不重複處理已完成的事件")
	void resumesFromCheckpoint() {
		// --- Given ---
		List<StoredEvent> firstBatch = eventStore.append("a1", Counter.TYPE,
				List.of(new ValueSet("a1", T0, 1), new ValueAdded("a1", T0, 2)), AppendOptions.expectedVersion(0));
		long lastOfFirstBatch = firstBatch.get(1).getGlobalSequence();
		positionRepository.savePosition(PROJECTION, firstBatch.get(0).getGlobalSequence() - 1);

		List<Long> received = new CopyOnWriteArrayList<>();
		subscription = subscriptionService.subscribeFromCheckpoint(PROJECTION,
				event -> received.add(event.getGlobalSequence()));

		await().atMost(Duration.ofSeconds(10))
				.untilAsserted(() -> assertThat(positionRepository.getPosition(PROJECTION)).isEqualTo(lastOfFirstBatch));
		subscription.unsubscribe();
		log.info(">>> [Given] 第一次訂閱處理到 {}", lastOfFirstBatch);

		// --- When ---
		List<StoredEvent> secondBatch = eventStore.append("a1", Counter.TYPE, List.of(new ValueAdded("a1", T0, 3)),
				AppendOptions.expectedVersion(2));
		List<Long> resumed = new CopyOnWriteArrayList<>();
		subscription = subscriptionService.subscribeFromCheckpoint(PROJECTION,
				event -> resumed.add(event.getGlobalSequence()));

		// --- Then ---
		long last = secondBatch.get(0).getGlobalSequence();
		await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> assertThat(resumed).containsExactly(last));
		await().atMost(Duration.ofSeconds(10))
				.untilAsserted(() -> assertThat(positionRepository.getPosition(PROJECTION)).isEqualTo(last));
		assertThat(received).hasSize(2);
	}

	@Test
	@DisplayName("checkpoint 只會往前推進")
	void positionNeverMovesBackwards() {
		assertThat(positionRepository.getPosition("unknown")).isZero();

		positionRepository.savePosition(PROJECTION, 10);
		positionRepository.savePosition(PROJECTION, 7);
		assertThat(positionRepository.getPosition(PROJECTION)).isEqualTo(10);

		positionRepository.savePosition(PROJECTION, 12);
		assertThat(positionRepository.getPosition(PROJECTION)).isEqualTo(12);
	}

	@Test
	@DisplayName("handler 失敗時不推進 checkpoint")
	void failedHandlerKeepsCheckpoint() {
		List<StoredEvent> stored = eventStore.append("a1", Counter.TYPE, List.of(new ValueSet("a1", T0, 1)),
				AppendOptions.expectedVersion(0));
		long before = stored.get(0).getGlobalSequence() - 1;
		positionRepository.savePosition(PROJECTION, before);
		List<Long> attempts = new CopyOnWriteArrayList<>();

		subscription = subscriptionService.subscribeFromCheckpoint(PROJECTION, event -> {
			attempts.add(event.getGlobalSequence());
			throw new IllegalStateException("投影失敗");
		});

		await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> assertThat(attempts).hasSize(3));
		assertThat(positionRepository.getPosition(PROJECTION)).isEqualTo(before);
	}
}

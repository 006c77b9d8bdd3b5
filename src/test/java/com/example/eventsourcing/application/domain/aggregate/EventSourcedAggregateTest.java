package com.example.eventsourcing.application.domain.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.exception.UnknownEventTypeException;
import com.example.eventsourcing.fixture.Counter;
import com.example.eventsourcing.fixture.CounterRenamed;
import com.example.eventsourcing.fixture.CounterState;
import com.example.eventsourcing.fixture.ValueAdded;
import com.example.eventsourcing.fixture.ValueMultiplied;
import com.example.eventsourcing.fixture.ValueSet;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>事件溯源聚合根基底類別測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 驗證 raise / replay 的版本推進、未提交緩衝區與重播的決定性。
 * </pre>
 */
@Slf4j
class EventSourcedAggregateTest {

	private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

	private final List<DomainEvent> history = List.of(new ValueSet("a1", T0, 10),
			new ValueAdded("a1", T0.plusSeconds(1), 5), new ValueMultiplied("a1", T0.plusSeconds(2), 2),
			new ValueAdded("a1", T0.plusSeconds(3), -7));

	@Test
	@DisplayName("raise：套用事件、放入緩衝區、版本 +1")
	void raiseAppliesAndBuffers() {
		// --- Given ---
		Counter counter = Counter.create("a1");

		// --- When ---
		counter.set(10, T0);
		counter.add(5, T0.plusSeconds(1));

		// --- Then ---
		assertThat(counter.getVersion().getValue()).isEqualTo(2);
		assertThat(counter.getState().getValue()).isEqualTo(15);
		assertThat(counter.getUncommittedEventCount()).isEqualTo(2);
		assertThat(counter.getVersionBeforeUncommitted()).isZero();
		assertThat(counter.getUncommittedEvents()).extracting(DomainEvent::getEventType)
				.containsExactly(ValueSet.TYPE, ValueAdded.TYPE);
	}

	@Test
	@DisplayName("未提交事件以唯讀副本回傳，清空緩衝區不影響版本與狀態")
	void uncommittedEventsAreDefensiveCopy() {
		Counter counter = Counter.create("a1");
		counter.set(3, T0);

		List<DomainEvent> snapshot = counter.getUncommittedEvents();
		assertThatThrownBy(() -> snapshot.add(new ValueAdded("a1", T0, 1)))
				.isInstanceOf(UnsupportedOperationException.class);

		counter.clearUncommittedEvents();

		assertThat(snapshot).hasSize(1);
		assertThat(counter.hasUncommittedEvents()).isFalse();
		assertThat(counter.getVersion().getValue()).isEqualTo(1);
		assertThat(counter.getVersionBeforeUncommitted()).isEqualTo(1);
		assertThat(counter.getState().getValue()).isEqualTo(3);
	}

	@Test
	@DisplayName("replayEvents 不寫入緩衝區，每筆事件版本 +1")
	void replayDoesNotBuffer() {
		Counter counter = Counter.create("a1");

		counter.replayEvents(history);

		assertThat(counter.hasUncommittedEvents()).isFalse();
		assertThat(counter.getVersion().getValue()).isEqualTo(4);
		assertThat(counter.getState()).isEqualTo(new CounterState(23, T0.plusSeconds(3)));
	}

	@Test
	@DisplayName("重播具決定性：一次重播與任意切分後連續重播結果相同")
	void replayIsAssociative() {
		Counter whole = Counter.create("a1");
		whole.replayEvents(history);

		for (int split = 0; split <= history.size(); split++) {
			Counter parts = Counter.create("a1");
			parts.replayEvents(history.subList(0, split));
			parts.replayEvents(history.subList(split, history.size()));

			log.info(">>> [Then] split={} → version={}, state={}", split, parts.getVersion(), parts.getState());
			assertThat(parts.getVersion()).isEqualTo(whole.getVersion());
			assertThat(parts.getState()).isEqualTo(whole.getState());
		}
	}

	@Test
	@DisplayName("從快照狀態重建後補齊事件，結果等同完整重播")
	void reconstituteFromSnapshotState() {
		Counter full = Counter.create("a1");
		full.replayEvents(history);

		Counter prefix = Counter.create("a1");
		prefix.replayEvents(history.subList(0, 2));
		Counter restored = new Counter("a1", prefix.getVersion(), prefix.getState());
		restored.replayEvents(history.subList(2, history.size()));

		assertThat(restored.getVersion()).isEqualTo(full.getVersion());
		assertThat(restored.getState()).isEqualTo(full.getState());
	}

	@Test
	@DisplayName("未知事件類型必須拋出例外，狀態與版本不變")
	void unknownEventTypeIsFatal() {
		Counter counter = Counter.create("a1");
		counter.set(1, T0);

		assertThatThrownBy(() -> counter.rename("x", T0)).isInstanceOf(UnknownEventTypeException.class)
				.hasMessageContaining("CounterRenamed");
		assertThatThrownBy(() -> counter.replayEvents(List.of(new CounterRenamed("a1", T0, "x"))))
				.isInstanceOf(UnknownEventTypeException.class);

		assertThat(counter.getVersion().getValue()).isEqualTo(1);
		assertThat(counter.getUncommittedEventCount()).isEqualTo(1);
	}

	@Test
	@DisplayName("不可 raise 其他聚合根的事件")
	void rejectsForeignEvent() {
		Counter counter = Counter.create("a1");

		assertThatThrownBy(() -> counter.raise(new ValueSet("a2", T0, 1))).isInstanceOf(IllegalArgumentException.class);
		assertThat(counter.getVersion().isInitial()).isTrue();
		assertThat(counter.hasUncommittedEvents()).isFalse();
	}

	@Test
	@DisplayName("不可重播其他聚合根的事件，整批不套用")
	void replayRejectsForeignEvent() {
		Counter counter = Counter.create("a1");
		List<DomainEvent> mixed = List.of(new ValueSet("a1", T0, 1), new ValueAdded("a2", T0.plusSeconds(1), 5));

		assertThatThrownBy(() -> counter.replayEvents(mixed)).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("a2");
		assertThat(counter.getVersion().isInitial()).isTrue();
		assertThat(counter.hasUncommittedEvents()).isFalse();
	}

	@Test
	@DisplayName("以 ID 判斷相等")
	void equalityById() {
		Counter a = Counter.create("a1");
		Counter b = Counter.create("a1");
		b.set(9, T0);

		assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
		assertThat(a).isNotEqualTo(Counter.create("a2"));
	}
}

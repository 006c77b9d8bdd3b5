package com.example.eventsourcing.application.domain.aggregate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.exception.UnknownEventTypeException;

/**
 * <h1>事件溯源聚合根基底類別 (Event-Sourced Aggregate)</h1>
 * <p>
 * 聚合根的狀態完全由事件推導而來：{@code state(N) = applyEvent(state(N-1), event[N])}，
 * {@code state(0)} 為該型別的零值。除了 {@link #applyEvent} 以外沒有任何修改狀態的途徑。
 * </p>
 *
 * <h2>兩種生命週期入口：</h2>
 * <ul>
 * <li><b>新建</b>：版本 0、零值狀態，之後透過業務方法呼叫 {@link #raise} 產生新事件。</li>
 * <li><b>重播</b>：從快照 (或零值) 的 {@code (version, state)} 建立，再以
 * {@link #replayEvents} 補齊快照之後的事件。</li>
 * </ul>
 *
 * <p>
 * <b>實作規範：</b> {@link #applyEvent} 必須是純函數，不可有 I/O、亂數或讀取系統時間 (時間一律取自事件本身)，
 * 遇到未知事件類型必須拋出 {@link UnknownEventTypeException}，不可默默略過。狀態型別 {@code S} 應為不可變物件。
 * </p>
 *
 * @param <S> 聚合根的狀態型別
 */
public abstract class EventSourcedAggregate<S> {

	private final String id;

	private AggregateVersion version;

	private S state;

	/**
	 * 尚未持久化的事件 (依產生順序)
	 */
	private final List<DomainEvent> uncommittedEvents = new ArrayList<>();

	protected EventSourcedAggregate(String id, AggregateVersion version, S state) {
		this.id = Objects.requireNonNull(id, "聚合根 ID 不可為空");
		this.version = Objects.requireNonNull(version, "聚合根版本不可為空");
		this.state = Objects.requireNonNull(state, "聚合根狀態不可為空");
	}

	/**
	 * 將單一事件套用到目前狀態，回傳新狀態。
	 *
	 * @param state 套用前的狀態
	 * @param event 領域事件
	 * @return 套用後的狀態
	 * @throws UnknownEventTypeException 事件類型不在此聚合根的處理範圍內
	 */
	protected abstract S applyEvent(S state, DomainEvent event);

	/**
	 * 業務方法專用：套用新事件、放入未提交緩衝區，並將版本 +1。
	 *
	 * @param event 新產生的領域事件
	 */
	protected final void raise(DomainEvent event) {
		requireOwnEvent(event);
		this.state = applyEvent(this.state, event);
		this.uncommittedEvents.add(event);
		this.version = this.version.increment();
	}

	/**
	 * 依序重播事件，每筆事件版本 +1，不會寫入未提交緩衝區。
	 * <p>
	 * 一次重播整串或拆成多次連續呼叫，結果完全相同。
	 * </p>
	 *
	 * @param events 已持久化的事件 (依版本遞增排序)
	 * @throws IllegalArgumentException 任一事件屬於其他聚合根 (整批不套用)
	 */
	public final void replayEvents(List<? extends DomainEvent> events) {
		events.forEach(this::requireOwnEvent);
		for (DomainEvent event : events) {
			this.state = applyEvent(this.state, event);
			this.version = this.version.increment();
		}
	}

	private void requireOwnEvent(DomainEvent event) {
		Objects.requireNonNull(event, "事件不可為空");
		if (!id.equals(event.getAggregateId())) {
			throw new IllegalArgumentException(
					"事件 " + event.getEventType() + " 屬於聚合根 " + event.getAggregateId() + "，不可套用到 " + id);
		}
	}

	/**
	 * @return 未提交事件的唯讀副本
	 */
	public List<DomainEvent> getUncommittedEvents() {
		return List.copyOf(uncommittedEvents);
	}

	/**
	 * 持久化成功後清空緩衝區，不影響版本與狀態。
	 */
	public void clearUncommittedEvents() {
		uncommittedEvents.clear();
	}

	public boolean hasUncommittedEvents() {
		return !uncommittedEvents.isEmpty();
	}

	public int getUncommittedEventCount() {
		return uncommittedEvents.size();
	}

	/**
	 * 產生本批未提交事件之前的版本，即寫入 Event Store 時的 expectedVersion。
	 */
	public long getVersionBeforeUncommitted() {
		return version.getValue() - uncommittedEvents.size();
	}

	public String getId() {
		return id;
	}

	public AggregateVersion getVersion() {
		return version;
	}

	public S getState() {
		return state;
	}

	/**
	 * 給子類別在 {@link #applyEvent} 的 default 分支使用
	 */
	protected UnknownEventTypeException unknownEvent(DomainEvent event) {
		return new UnknownEventTypeException(getClass().getSimpleName(), event.getEventType());
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (other == null || getClass() != other.getClass()) {
			return false;
		}
		return id.equals(((EventSourcedAggregate<?>) other).id);
	}

	@Override
	public int hashCode() {
		return id.hashCode();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[id=" + id + ", version=" + version + ", state=" + state + "]";
	}
}

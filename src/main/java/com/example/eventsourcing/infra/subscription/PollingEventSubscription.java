package com.example.eventsourcing.infra.subscription;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.LongFunction;

import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.port.EventSubscription;
import com.example.eventsourcing.application.port.StoredEventHandler;
import com.example.eventsourcing.config.config.EventSourcingProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>輪詢式事件訂閱</h1>
 * <p>
 * 每個訂閱擁有一條專屬的排程執行緒，以固定間隔 (fixed delay) 讀取 {@code position} 之後的事件並依序投遞， 兩次輪詢永遠不會重疊。
 * </p>
 *
 * <h2>投遞語義：</h2>
 * <ul>
 * <li><b>至少一次 (At-least-once)</b>：handler 失敗時不推進位置，下次輪詢重新投遞同一筆事件。</li>
 * <li><b>毒藥事件隔離</b>：同一筆事件連續失敗達 {@code maxDeliveryAttempts} 次後記錄 error 並跳過，避免整條訂閱卡死。</li>
 * <li><b>讀取失敗</b>：僅記錄 log，下次輪詢自動重試。</li>
 * <li><b>序號缺口</b>：自增序號在交易開始時配發、提交時才可見，序號較小的交易可能較晚提交。
 * 下一筆事件不是 {@code position + 1} 時停在缺口前等待，缺口持續超過 {@code gapTimeout} 才視為回滾造成的空號並跳過。</li>
 * </ul>
 */
@Slf4j
public class PollingEventSubscription implements EventSubscription {

	private static final long TERMINATION_TIMEOUT_SECONDS = 10;

	private final String id;

	private final StoredEventHandler handler;

	/**
	 * 給定目前位置，回傳之後的一批事件 (依 globalSequence 遞增)
	 */
	private final LongFunction<List<StoredEvent>> fetcher;

	private final Duration pollInterval;

	private final int maxDeliveryAttempts;

	private final Duration gapTimeout;

	private final Consumer<PollingEventSubscription> onClose;

	private final ScheduledExecutorService scheduler;

	private final AtomicBoolean active = new AtomicBoolean(true);

	private volatile long position;

	private volatile Thread pollerThread;

	// 以下兩個欄位只在輪詢執行緒上讀寫
	private long failingSequence = -1;

	private int failedAttempts;

	/**
	 * 正在等待的缺口起點 (position + 1)，-1 代表目前沒有缺口
	 */
	private long pendingGapSequence = -1;

	private long pendingGapSinceNanos;

	public PollingEventSubscription(String id, long fromSequence, StoredEventHandler handler,
			LongFunction<List<StoredEvent>> fetcher, EventSourcingProperties.Subscription config,
			Consumer<PollingEventSubscription> onClose) {
		this.id = id;
		this.position = fromSequence;
		this.handler = handler;
		this.fetcher = fetcher;
		this.pollInterval = config.getPollInterval();
		this.maxDeliveryAttempts = Math.max(1, config.getMaxDeliveryAttempts());
		this.gapTimeout = config.getGapTimeout();
		this.onClose = onClose;
		this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "event-subscription-" + id);
			thread.setDaemon(true);
			this.pollerThread = thread;
			return thread;
		});
	}

	/**
	 * 啟動輪詢，第一次輪詢立即執行
	 */
	public void start() {
		scheduler.scheduleWithFixedDelay(this::poll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
		log.info(">>> [Subscription] 訂閱 {} 已啟動，起始位置: {}", id, position);
	}

	private void poll() {
		// 任何例外外洩都會讓排程器默默取消週期任務
		try {
			pollOnce();
		} catch (Throwable e) {
			log.error(">>> [Subscription] 訂閱 {} 輪詢發生未預期錯誤 (position={})，下次輪詢重試", id, position, e);
		}
	}

	private void pollOnce() {
		if (!active.get()) {
			return;
		}

		List<StoredEvent> events;
		try {
			events = fetcher.apply(position);
		} catch (RuntimeException e) {
			log.error(">>> [Subscription] 訂閱 {} 讀取事件失敗 (position={})，下次輪詢重試: {}", id, position, e.getMessage(), e);
			return;
		}

		for (StoredEvent event : events) {
			// 取消後不再開始新的 handler 呼叫
			if (!active.get()) {
				return;
			}
			if (!gapResolved(event.getGlobalSequence())) {
				return;
			}
			if (!deliver(event)) {
				return;
			}
			position = event.getGlobalSequence();
		}
	}

	/**
	 * @return true 代表可以投遞這筆事件 (序號連續，或缺口已等待超過 gapTimeout)
	 */
	private boolean gapResolved(long sequence) {
		long expected = position + 1;
		if (sequence == expected) {
			pendingGapSequence = -1;
			return true;
		}

		if (pendingGapSequence != expected) {
			pendingGapSequence = expected;
			pendingGapSinceNanos = System.nanoTime();
			log.debug(">>> [Subscription] 訂閱 {} 發現序號缺口 {}..{}，等待較早的交易提交", id, expected, sequence - 1);
			return false;
		}

		if (System.nanoTime() - pendingGapSinceNanos < gapTimeout.toNanos()) {
			return false;
		}

		log.warn(">>> [Subscription] 訂閱 {} 序號缺口 {}..{} 超過 {} 仍未補齊，視為空號跳過", id, expected, sequence - 1,
				gapTimeout);
		pendingGapSequence = -1;
		return true;
	}

	/**
	 * @return true 代表可以推進位置 (處理成功或已放棄)
	 */
	private boolean deliver(StoredEvent event) {
		try {
			handler.handle(event);
			failingSequence = -1;
			failedAttempts = 0;
			return true;
		} catch (Throwable e) {
			if (failingSequence != event.getGlobalSequence()) {
				failingSequence = event.getGlobalSequence();
				failedAttempts = 0;
			}
			failedAttempts++;

			if (failedAttempts >= maxDeliveryAttempts) {
				log.error(">>> [Subscription] 訂閱 {} 處理事件失敗已達 {} 次，跳過事件 seq={} type={}", id, failedAttempts,
						event.getGlobalSequence(), event.getEventType(), e);
				failingSequence = -1;
				failedAttempts = 0;
				return true;
			}

			log.error(">>> [Subscription] 訂閱 {} 處理事件失敗 (第 {} 次)，seq={} type={}，下次輪詢重試", id, failedAttempts,
					event.getGlobalSequence(), event.getEventType(), e);
			return false;
		}
	}

	@Override
	public void unsubscribe() {
		if (!active.compareAndSet(true, false)) {
			return;
		}

		scheduler.shutdown();
		// 在 handler 內取消時不能等待自己結束
		if (Thread.currentThread() != pollerThread) {
			try {
				if (!scheduler.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
					log.warn(">>> [Subscription] 訂閱 {} 等待進行中的輪詢結束逾時", id);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				log.warn(">>> [Subscription] 訂閱 {} 等待輪詢結束時被中斷", id);
			}
		}

		onClose.accept(this);
		log.info(">>> [Subscription] 訂閱 {} 已取消，最後位置: {}", id, position);
	}

	@Override
	public String getId() {
		return id;
	}

	@Override
	public boolean isActive() {
		return active.get();
	}

	@Override
	public long getPosition() {
		return position;
	}
}

package com.example.eventsourcing.application.domain.exception;

import lombok.Getter;

/**
 * 樂觀鎖衝突
 * <p>
 * 寫入時的 expectedVersion 與事件流目前版本不符，代表另一個寫入者已搶先提交。 呼叫端應重新載入聚合根、重新執行命令後再試。
 * </p>
 */
@Getter
public class ConcurrencyException extends EventStoreException {

	private static final long serialVersionUID = 1L;

	private final String aggregateType;

	private final String aggregateId;

	private final long expectedVersion;

	private final long actualVersion;

	public ConcurrencyException(String aggregateType, String aggregateId, long expectedVersion, long actualVersion) {
		this(aggregateType, aggregateId, expectedVersion, actualVersion, null);
	}

	public ConcurrencyException(String aggregateType, String aggregateId, long expectedVersion, long actualVersion,
			Throwable cause) {
		super(String.format("聚合根 %s[%s] 版本衝突: expected=%d, actual=%d", aggregateType, aggregateId, expectedVersion,
				actualVersion), cause);
		this.aggregateType = aggregateType;
		this.aggregateId = aggregateId;
		this.expectedVersion = expectedVersion;
		this.actualVersion = actualVersion;
	}
}

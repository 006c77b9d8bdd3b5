package com.example.eventsourcing.application.port;

/**
 * 事件訂閱的控制代碼
 */
public interface EventSubscription {

	String getId();

	/**
	 * 取消訂閱。返回後不會再有新的 handler 呼叫開始；可重複呼叫，也可在 handler 內呼叫。
	 */
	void unsubscribe();

	boolean isActive();

	/**
	 * @return 最後一筆已投遞 (或放棄) 事件的 globalSequence
	 */
	long getPosition();
}

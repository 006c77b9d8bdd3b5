package com.example.eventsourcing.application.port;

import com.example.eventsourcing.application.domain.event.StoredEvent;

/**
 * 訂閱事件的處理器，丟出例外代表處理失敗，該事件會被重新投遞
 */
@FunctionalInterface
public interface StoredEventHandler {

	void handle(StoredEvent event) throws Exception;
}

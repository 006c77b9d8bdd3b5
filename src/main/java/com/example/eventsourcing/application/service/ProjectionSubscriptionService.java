package com.example.eventsourcing.application.service;

import org.springframework.stereotype.Service;

import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.EventSubscription;
import com.example.eventsourcing.application.port.ProjectionPositionRepositoryPort;
import com.example.eventsourcing.application.port.StoredEventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>斷點續傳訂閱服務</h1>
 * <p>
 * 供外部投影使用：從 {@code projection_positions} 記錄的位置開始訂閱，每筆事件處理成功後推進 checkpoint，
 * 重啟後即可接續處理。handler 失敗時不推進 checkpoint，交由訂閱重新投遞。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectionSubscriptionService {

	private final EventStorePort eventStore;

	private final ProjectionPositionRepositoryPort positionRepository;

	/**
	 * @param projectionName 投影名稱，作為 checkpoint 的 key
	 * @param handler        事件處理器，需能承受重複事件
	 * @return 訂閱控制代碼
	 */
	public EventSubscription subscribeFromCheckpoint(String projectionName, StoredEventHandler handler) {
		long position = positionRepository.getPosition(projectionName);
		log.info(">>> [Projection] 投影 {} 從位置 {} 開始訂閱", projectionName, position);

		return eventStore.subscribe(position, event -> {
			handler.handle(event);
			positionRepository.savePosition(projectionName, event.getGlobalSequence());
		});
	}
}

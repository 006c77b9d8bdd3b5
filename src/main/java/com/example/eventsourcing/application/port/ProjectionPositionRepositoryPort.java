package com.example.eventsourcing.application.port;

/**
 * 投影進度 (checkpoint) 儲存端口
 */
public interface ProjectionPositionRepositoryPort {

	/**
	 * @return 已處理的最大 globalSequence，未曾記錄時為 0
	 */
	long getPosition(String projectionName);

	/**
	 * 更新進度，只會往前推進
	 */
	void savePosition(String projectionName, long sequence);
}

package com.example.eventsourcing.infra.event.codec;

import com.example.eventsourcing.application.domain.exception.EventSerializationException;

import tools.jackson.databind.ObjectMapper;

/**
 * 事件與快照狀態的 JSON 編解碼器
 *
 * <p>
 * 負責將 Domain Event、EventMetadata 及聚合根狀態與資料庫中的 JSON 文字互相轉換，不依賴任何儲存結構。
 * </p>
 *
 * <p>
 * 序列化/反序列化失敗一律視為系統錯誤，拋出 {@link EventSerializationException}。
 * </p>
 */
public class EventJsonCodec {

	private final ObjectMapper objectMapper;

	/**
	 * @param objectMapper Jackson ObjectMapper
	 */
	public EventJsonCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * 將物件序列化為 JSON 字串
	 *
	 * @param value 事件、Metadata 或聚合根狀態
	 * @return JSON 字串
	 */
	public String serialize(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (Exception e) {
			throw new EventSerializationException(value.getClass().getSimpleName() + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON 字串反序列化為指定型別
	 *
	 * @param json JSON 字串
	 * @param type 目標型別
	 * @return 反序列化結果
	 */
	public <T> T deserialize(String json, Class<T> type) {
		try {
			return objectMapper.readValue(json, type);
		} catch (Exception e) {
			throw new EventSerializationException(type.getSimpleName() + " JSON 反序列化失敗", e);
		}
	}
}

package com.example.shipment.infra.event.codec;

import com.example.shipment.application.shared.exception.EventDecodeException;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * JSON 編解碼器
 *
 * <p>
 * 負責將 Domain Event 與聚合快照轉換為 JSON byte[]，完全獨立於 EventStore 與 Blob 儲存體。
 * </p>
 *
 * <p>
 * 序列化失敗視為程式錯誤 ({@link IllegalStateException})；反序列化失敗代表儲存的資料已損毀或版本不相容，
 * 一律拋出 {@link EventDecodeException}。
 * </p>
 */
public class JsonPayloadCodec {

	private final ObjectMapper objectMapper;

	/**
	 * @param objectMapper Jackson ObjectMapper
	 */
	public JsonPayloadCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * 將物件序列化為 JSON byte[]
	 */
	public byte[] serialize(Object value) {
		try {
			return objectMapper.writeValueAsBytes(value);
		} catch (JacksonException e) {
			throw new IllegalStateException(value.getClass().getSimpleName() + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON byte[] 反序列化為指定型別
	 *
	 * @throws EventDecodeException 內容無法解讀時拋出
	 */
	public <T> T deserialize(byte[] data, Class<T> type) {
		try {
			T value = objectMapper.readValue(data, type);
			if (value == null) {
				throw new EventDecodeException(type.getSimpleName() + " JSON 內容為 null");
			}
			return value;
		} catch (JacksonException e) {
			throw new EventDecodeException(type.getSimpleName() + " JSON 反序列化失敗", e);
		}
	}

	/**
	 * 透過一次序列化往返建立深度複本
	 */
	public <T> T copy(T value, Class<T> type) {
		return deserialize(serialize(value), type);
	}
}

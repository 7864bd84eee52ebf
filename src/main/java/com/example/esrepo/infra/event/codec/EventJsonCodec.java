package com.example.esrepo.infra.event.codec;

import java.util.LinkedHashMap;
import java.util.Map;

import com.example.esrepo.application.exception.EventDecodeException;
import com.example.esrepo.application.port.CommitHeaders;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;

/**
 * 事件信封 JSON 編解碼器
 *
 * <p>
 * 將 Domain Event 與提交標頭轉成 (payload, metadata) 兩段 JSON byte[]，並依 metadata 中的
 * {@value CommitHeaders#EVENT_TYPE_NAME} 標籤，透過 {@link EventTypeRegistry} 還原為具體型別。
 * 完全獨立於 EventStore 與倉儲流程。
 * </p>
 *
 * <p>
 * 相容性：metadata 中多出的自訂標頭與 payload 中未知欄位都會被忽略，舊版讀者不會因此失敗。
 * </p>
 */
public class EventJsonCodec {

	private static final TypeReference<LinkedHashMap<String, Object>> HEADER_MAP = new TypeReference<>() {
	};

	private final ObjectMapper objectMapper;
	private final EventTypeRegistry registry;

	/**
	 * @param objectMapper Jackson ObjectMapper
	 * @param registry     事件型別註冊表
	 */
	public EventJsonCodec(ObjectMapper objectMapper, EventTypeRegistry registry) {
		this.objectMapper = objectMapper;
		this.registry = registry;
	}

	/**
	 * 編碼事件與標頭
	 *
	 * @param event   Domain Event，型別必須已註冊
	 * @param headers 提交標頭
	 * @return 編碼結果
	 * @throws IllegalStateException 型別未註冊或序列化失敗
	 */
	public EncodedEvent encode(Object event, Map<String, Object> headers) {
		String eventType = registry.tagOf(event.getClass())
				.orElseThrow(() -> new IllegalStateException("事件型別未註冊: " + event.getClass().getName()));

		Map<String, Object> eventHeaders = new LinkedHashMap<>(headers);
		eventHeaders.put(CommitHeaders.EVENT_TYPE_NAME, eventType);

		try {
			byte[] payload = objectMapper.writeValueAsBytes(event);
			byte[] metadata = objectMapper.writeValueAsBytes(eventHeaders);
			return new EncodedEvent(eventType, payload, metadata);
		} catch (JacksonException e) {
			throw new IllegalStateException(eventType + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 依 metadata 中的型別標籤還原事件
	 *
	 * @throws EventDecodeException 標籤缺失、未註冊，或 JSON 結構錯誤
	 */
	public Object decode(byte[] metadata, byte[] payload) {
		Object tag = readHeaders(metadata).get(CommitHeaders.EVENT_TYPE_NAME);
		if (!(tag instanceof String eventType) || eventType.isBlank()) {
			throw new EventDecodeException("metadata 缺少事件型別標籤 " + CommitHeaders.EVENT_TYPE_NAME);
		}
		Class<?> type = registry.resolve(eventType)
				.orElseThrow(() -> new EventDecodeException("無法解析事件型別標籤: " + eventType));

		if (payload == null || payload.length == 0) {
			throw new EventDecodeException(eventType + " payload 為空");
		}
		try {
			Object event = objectMapper.readerFor(type)
					.without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
					.readValue(payload);
			if (event == null) {
				throw new EventDecodeException(eventType + " payload 為 null");
			}
			return event;
		} catch (JacksonException e) {
			throw new EventDecodeException(eventType + " JSON 反序列化失敗", e);
		}
	}

	/**
	 * 讀出 metadata 中所有標頭 (含自訂標頭)
	 *
	 * @throws EventDecodeException metadata 不是 JSON 物件
	 */
	public Map<String, Object> readHeaders(byte[] metadata) {
		if (metadata == null || metadata.length == 0) {
			throw new EventDecodeException("metadata 為空");
		}
		try {
			Map<String, Object> headers = objectMapper.readValue(metadata, HEADER_MAP);
			if (headers == null) {
				throw new EventDecodeException("metadata 不是 JSON 物件");
			}
			return headers;
		} catch (JacksonException e) {
			throw new EventDecodeException("metadata JSON 反序列化失敗", e);
		}
	}
}

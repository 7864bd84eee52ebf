package com.example.esrepo.infra.event.codec;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;

/**
 * 事件型別註冊表：型別標籤 ↔ 具體類別
 * <p>
 * 反序列化只接受啟動時明確註冊過的型別，不做任意類別名稱的動態載入。
 * 預設標籤為類別的 simple name。
 * </p>
 */
@Slf4j
public class EventTypeRegistry {

	private final Map<String, Class<?>> typesByTag = new ConcurrentHashMap<>();
	private final Map<Class<?>, String> tagsByType = new ConcurrentHashMap<>();

	/**
	 * 以 simple name 為標籤註冊
	 */
	public EventTypeRegistry register(Class<?> eventType) {
		return register(eventType.getSimpleName(), eventType);
	}

	/**
	 * 以指定標籤註冊；同一標籤對應到不同類別時拒絕
	 *
	 * @throws IllegalArgumentException 標籤衝突
	 */
	public synchronized EventTypeRegistry register(String tag, Class<?> eventType) {
		if (tag == null || tag.isBlank()) {
			throw new IllegalArgumentException("事件型別標籤不可為空");
		}
		Class<?> existing = typesByTag.get(tag);
		if (existing != null && !existing.equals(eventType)) {
			throw new IllegalArgumentException(
					"事件型別標籤 " + tag + " 已對應 " + existing.getName() + "，無法再註冊 " + eventType.getName());
		}
		typesByTag.put(tag, eventType);
		tagsByType.put(eventType, tag);
		log.debug("[EventTypeRegistry] 註冊事件型別: {} -> {}", tag, eventType.getName());
		return this;
	}

	public Optional<Class<?>> resolve(String tag) {
		return Optional.ofNullable(typesByTag.get(tag));
	}

	public Optional<String> tagOf(Class<?> eventType) {
		return Optional.ofNullable(tagsByType.get(eventType));
	}

	public boolean isRegistered(Class<?> eventType) {
		return tagsByType.containsKey(eventType);
	}
}

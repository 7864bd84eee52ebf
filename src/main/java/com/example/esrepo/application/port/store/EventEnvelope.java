package com.example.esrepo.application.port.store;

import java.util.UUID;

/**
 * 待寫入的事件信封
 *
 * @param eventId   每筆事件唯一 ID，供儲存端去重
 * @param eventType 事件型別標籤 (同時寫入 metadata)
 * @param payload   事件 JSON
 * @param metadata  標頭 JSON
 */
public record EventEnvelope(UUID eventId, String eventType, byte[] payload, byte[] metadata) {
}

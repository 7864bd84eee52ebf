package com.example.esrepo.application.port.store;

import java.util.UUID;

/**
 * 從 Stream 讀回的事件信封
 *
 * @param streamName 所屬 Stream
 * @param position   Stream 內序號 (從 1 開始，0 保留給建立標記)
 * @param eventId    寫入時的事件 ID
 * @param eventType  事件型別標籤
 * @param payload    事件 JSON
 * @param metadata   標頭 JSON
 */
public record RecordedEnvelope(String streamName, long position, UUID eventId, String eventType, byte[] payload,
		byte[] metadata) {
}

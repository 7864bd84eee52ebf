package com.example.esrepo.infra.event.codec;

/**
 * 編碼後的單筆事件
 *
 * @param eventType 事件型別標籤
 * @param payload   事件欄位 JSON
 * @param metadata  標頭 JSON (含事件型別標籤)
 */
public record EncodedEvent(String eventType, byte[] payload, byte[] metadata) {
}

package com.example.esrepo.infra.event.mapper;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.example.esrepo.application.port.store.EventEnvelope;
import com.example.esrepo.application.port.store.RecordedEnvelope;

/**
 * 事件信封與 EventStoreDB 資料結構之間的映射器
 *
 * <p>
 * 專責格式轉換，不含編解碼與業務邏輯，避免倉儲直接依賴 EventStoreDB 型別。
 * </p>
 *
 * <p>
 * 序號換算：倉儲的序號從 1 開始 (0 為建立標記)，EventStoreDB 的 revision 從 0 開始，
 * 因此 {@code position = revision + 1}。
 * </p>
 */
public class EventStoreEventMapper {

	/**
	 * 將信封封裝為可寫入的 {@link EventData}，沿用信封的事件 ID 供儲存端去重
	 */
	public EventData toEventData(EventEnvelope envelope) {
		return EventData.builderAsJson(envelope.eventId(), envelope.eventType(), envelope.payload())
				.metadataAsBytes(envelope.metadata())
				.build();
	}

	/**
	 * 將讀到的 {@link ResolvedEvent} 轉為信封
	 * <p>
	 * 序號取自 original event (即本 Stream 中的位置)，資料取自解析後的事件。
	 * </p>
	 */
	public RecordedEnvelope toRecordedEnvelope(String streamName, ResolvedEvent resolvedEvent) {
		RecordedEvent original = resolvedEvent.getOriginalEvent();
		RecordedEvent event = resolvedEvent.getEvent() != null ? resolvedEvent.getEvent() : original;
		return new RecordedEnvelope(streamName, toPosition(original.getRevision()), event.getEventId(),
				event.getEventType(), event.getEventData(), event.getUserMetadata());
	}

	public static long toPosition(long revision) {
		return revision + 1;
	}

	public static long toRevision(long position) {
		return position - 1;
	}
}

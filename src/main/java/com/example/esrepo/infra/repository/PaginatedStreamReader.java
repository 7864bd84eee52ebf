package com.example.esrepo.infra.repository;

import com.example.esrepo.application.domain.aggregate.EventSourcedAggregate;
import com.example.esrepo.application.exception.EventDecodeException;
import com.example.esrepo.application.exception.RepositoryOperationCancelledException;
import com.example.esrepo.application.exception.VersionNotFoundException;
import com.example.esrepo.application.port.store.EventStoreClientPort;
import com.example.esrepo.application.port.store.RecordedEnvelope;
import com.example.esrepo.application.port.store.StreamPage;
import com.example.esrepo.infra.event.codec.EventJsonCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * 分頁重播器
 *
 * <p>
 * 從序號 1 開始 (跳過序號 0 的 Stream 建立標記) 以固定頁大小順向讀取，逐筆解碼並套用到聚合根。
 * 不論儲存端需要幾頁，重建結果都必須相同。
 * </p>
 *
 * <ul>
 * <li>儲存端的 Stream 不存在 / 已刪除錯誤原封不動往上拋</li>
 * <li>解碼失敗會補上 Stream、聚合根型別與序號後再拋出</li>
 * <li>每頁之間檢查執行緒中斷</li>
 * </ul>
 */
@Slf4j
public class PaginatedStreamReader {

	/**
	 * 第一筆 Domain Event 的序號，序號 0 保留給 Stream 建立標記
	 */
	public static final long FIRST_EVENT_POSITION = 1;

	private final EventStoreClientPort client;
	private final EventJsonCodec codec;
	private final int readPageSize;

	public PaginatedStreamReader(EventStoreClientPort client, EventJsonCodec codec, int readPageSize) {
		if (readPageSize < 1) {
			throw new IllegalArgumentException("readPageSize 必須大於 0: " + readPageSize);
		}
		this.client = client;
		this.codec = codec;
		this.readPageSize = readPageSize;
	}

	/**
	 * 重播整條 Stream
	 *
	 * @param streamName Stream 名稱
	 * @param aggregate  空白聚合根
	 * @return 同一個聚合根實例
	 */
	public <A extends EventSourcedAggregate> A replay(String streamName, A aggregate) {
		long cursor = FIRST_EVENT_POSITION;
		int pages = 0;
		StreamPage page;
		do {
			checkInterrupted(streamName, cursor);
			page = client.readStreamForward(streamName, cursor, readPageSize, false);
			applyPage(streamName, aggregate, page);
			cursor = advance(streamName, cursor, page);
			pages++;
		} while (!page.endOfStream());

		log.debug(">>> [Replay] Stream {} 重播完成，共 {} 頁，版本 {}", streamName, pages, aggregate.getVersion());
		return aggregate;
	}

	/**
	 * 只重播到 targetVersion (含)
	 *
	 * @throws VersionNotFoundException Stream 在到達 targetVersion 前就結束
	 */
	public <A extends EventSourcedAggregate> A replay(String streamName, A aggregate, long targetVersion) {
		if (targetVersion < FIRST_EVENT_POSITION) {
			throw new IllegalArgumentException("目標版本必須大於 0: " + targetVersion);
		}

		long cursor = FIRST_EVENT_POSITION;
		int pages = 0;
		StreamPage page;
		do {
			checkInterrupted(streamName, cursor);
			// 頁大小夾在 targetVersion 之內，游標不會越過目標版本
			int count = (int) Math.min(readPageSize, targetVersion - cursor + 1);
			page = client.readStreamForward(streamName, cursor, count, false);
			applyPage(streamName, aggregate, page);
			cursor = advance(streamName, cursor, page);
			pages++;
		} while (cursor <= targetVersion && !page.endOfStream());

		if (aggregate.getVersion() < targetVersion) {
			throw new VersionNotFoundException(streamName, targetVersion, aggregate.getVersion());
		}
		log.debug(">>> [Replay] Stream {} 重播至版本 {}，共 {} 頁", streamName, targetVersion, pages);
		return aggregate;
	}

	private void applyPage(String streamName, EventSourcedAggregate aggregate, StreamPage page) {
		for (RecordedEnvelope recorded : page.events()) {
			Object event;
			try {
				event = codec.decode(recorded.metadata(), recorded.payload());
			} catch (EventDecodeException e) {
				throw new EventDecodeException("Stream " + streamName + " 序號 " + recorded.position() + " (聚合根 "
						+ aggregate.getClass().getName() + ") 解碼失敗: " + e.getMessage(), e);
			}
			aggregate.applyEvent(event);
		}
	}

	private long advance(String streamName, long cursor, StreamPage page) {
		if (!page.endOfStream() && page.nextPosition() <= cursor) {
			throw new IllegalStateException(
					"Stream " + streamName + " 回傳的下一頁序號 " + page.nextPosition() + " 未前進 (目前 " + cursor + ")");
		}
		return page.nextPosition();
	}

	private void checkInterrupted(String streamName, long cursor) {
		if (Thread.currentThread().isInterrupted()) {
			throw new RepositoryOperationCancelledException(
					"Stream " + streamName + " 重播於序號 " + cursor + " 前被中斷");
		}
	}
}

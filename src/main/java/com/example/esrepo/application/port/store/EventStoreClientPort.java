package com.example.esrepo.application.port.store;

import java.util.List;

/**
 * 事件儲存端客戶端 Port
 * <p>
 * 倉儲只依賴這三個原語。實作必須以不同例外區分以下情境：
 * </p>
 * <ul>
 * <li>Stream 不存在 → {@link com.example.esrepo.application.exception.AggregateNotFoundException}</li>
 * <li>Stream 已刪除 → {@link com.example.esrepo.application.exception.AggregateDeletedException}</li>
 * <li>預期版本不符 → {@link com.example.esrepo.application.exception.ConcurrencyConflictException}</li>
 * <li>其他傳輸失敗 → {@link com.example.esrepo.application.exception.EventStoreAccessException}</li>
 * </ul>
 */
public interface EventStoreClientPort {

	/**
	 * 從指定序號起順向讀取最多 count 筆事件
	 *
	 * @param streamName    Stream 名稱
	 * @param startPosition 起始序號 (含)
	 * @param count         本頁最大筆數
	 * @param resolveLinks  是否解析 link 事件
	 * @return 讀取結果頁
	 */
	StreamPage readStreamForward(String streamName, long startPosition, int count, boolean resolveLinks);

	/**
	 * 原子性追加一批事件
	 *
	 * @param streamName      Stream 名稱
	 * @param expectedVersion 預期版本，或 {@link ExpectedVersion} 的特殊值
	 * @param envelopes       事件信封
	 */
	void appendToStream(String streamName, long expectedVersion, List<EventEnvelope> envelopes);

	/**
	 * 開啟分頁寫入交易
	 */
	StreamTransaction startTransaction(String streamName, long expectedVersion);
}

package com.example.esrepo.infra.repository;

import java.util.List;

import com.example.esrepo.application.exception.RepositoryOperationCancelledException;
import com.example.esrepo.application.port.store.EventEnvelope;
import com.example.esrepo.application.port.store.EventStoreClientPort;
import com.example.esrepo.application.port.store.ExpectedVersion;
import com.example.esrepo.application.port.store.StreamTransaction;

import lombok.extern.slf4j.Slf4j;

/**
 * 寫入規劃器
 *
 * <pre>
 * 1. 信封數 &lt; writePageSize：單次原子性 append
 * 2. 否則：開啟交易，依 writePageSize 分頁寫入，全部寫完才 commit
 * </pre>
 *
 * <p>
 * commit 前發生任何錯誤或中斷都會放棄交易，讀者看不到部分寫入。樂觀鎖衝突由儲存端判定，
 * 此處不重試、不包裝。
 * </p>
 */
@Slf4j
public class EventWritePlanner {

	private final EventStoreClientPort client;
	private final int writePageSize;

	public EventWritePlanner(EventStoreClientPort client, int writePageSize) {
		if (writePageSize < 1) {
			throw new IllegalArgumentException("writePageSize 必須大於 0: " + writePageSize);
		}
		this.client = client;
		this.writePageSize = writePageSize;
	}

	/**
	 * 版本 0 代表從未寫入過，對應儲存端的「Stream 尚不存在」
	 */
	public static long toStoreExpectedVersion(long originalVersion) {
		return originalVersion == 0 ? ExpectedVersion.NO_STREAM : originalVersion;
	}

	/**
	 * 寫入一批信封
	 *
	 * @param streamName      Stream 名稱
	 * @param originalVersion 聚合根寫入前的版本
	 * @param envelopes       依順序排列的信封
	 */
	public void write(String streamName, long originalVersion, List<EventEnvelope> envelopes) {
		if (envelopes.isEmpty()) {
			log.debug(">>> [Write] Stream {} 沒有新事件，略過寫入", streamName);
			return;
		}

		long expectedVersion = toStoreExpectedVersion(originalVersion);
		if (envelopes.size() < writePageSize) {
			client.appendToStream(streamName, expectedVersion, envelopes);
			log.debug(">>> [Write] Stream {} 單次寫入 {} 筆 (expectedVersion={})", streamName, envelopes.size(),
					expectedVersion);
			return;
		}

		writeInTransaction(streamName, expectedVersion, envelopes);
	}

	private void writeInTransaction(String streamName, long expectedVersion, List<EventEnvelope> envelopes) {
		StreamTransaction transaction = client.startTransaction(streamName, expectedVersion);
		int pages = 0;
		try {
			for (int from = 0; from < envelopes.size(); from += writePageSize) {
				checkInterrupted(streamName, from);
				transaction.write(envelopes.subList(from, Math.min(from + writePageSize, envelopes.size())));
				pages++;
			}
			checkInterrupted(streamName, envelopes.size());
			transaction.commit();
		} catch (RuntimeException e) {
			rollback(streamName, transaction, e);
			throw e;
		}
		log.info(">>> [Write] Stream {} 交易寫入 {} 筆，共 {} 頁 (expectedVersion={})", streamName, envelopes.size(),
				pages, expectedVersion);
	}

	private void rollback(String streamName, StreamTransaction transaction, RuntimeException cause) {
		try {
			transaction.rollback();
			log.warn(">>> [Write] Stream {} 交易已放棄: {}", streamName, cause.getMessage());
		} catch (RuntimeException rollbackFailure) {
			cause.addSuppressed(rollbackFailure);
		}
	}

	private void checkInterrupted(String streamName, int written) {
		if (Thread.currentThread().isInterrupted()) {
			throw new RepositoryOperationCancelledException(
					"Stream " + streamName + " 交易寫入於第 " + written + " 筆前被中斷，尚未 commit");
		}
	}
}

package com.example.esrepo.infra.adapter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.example.esrepo.application.exception.AggregateDeletedException;
import com.example.esrepo.application.exception.AggregateNotFoundException;
import com.example.esrepo.application.exception.ConcurrencyConflictException;
import com.example.esrepo.application.port.store.EventEnvelope;
import com.example.esrepo.application.port.store.EventStoreClientPort;
import com.example.esrepo.application.port.store.ExpectedVersion;
import com.example.esrepo.application.port.store.RecordedEnvelope;
import com.example.esrepo.application.port.store.StreamPage;
import com.example.esrepo.application.port.store.StreamTransaction;

import lombok.extern.slf4j.Slf4j;

/**
 * 記憶體內事件儲存
 *
 * <p>
 * 提供與真實儲存端相同的語意，用於測試與本機開發：
 * </p>
 * <ul>
 * <li>序號 0 為隱含的 Stream 建立標記，第一筆事件位於序號 1</li>
 * <li>每條 Stream 的樂觀鎖檢查與追加在同一把寫鎖內完成</li>
 * <li>交易在 commit 前只暫存在交易物件中</li>
 * <li>{@link #deleteStream(String)} 產生墓碑，之後的讀寫皆回報已刪除</li>
 * </ul>
 */
@Slf4j
public class InMemoryEventStoreClient implements EventStoreClientPort {

	private final Map<String, StoredStream> streams = new HashMap<>();
	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	@Override
	public StreamPage readStreamForward(String streamName, long startPosition, int count, boolean resolveLinks) {
		if (startPosition < 0 || count < 1) {
			throw new IllegalArgumentException("startPosition 不可為負且 count 必須大於 0");
		}
		lock.readLock().lock();
		try {
			StoredStream stream = existingStream(streamName);
			long lastPosition = stream.events.size();
			long from = Math.max(startPosition, 1);
			long to = Math.min(from + count - 1, lastPosition);

			List<RecordedEnvelope> page = new ArrayList<>();
			for (long position = from; position <= to; position++) {
				page.add(stream.events.get((int) position - 1));
			}
			long nextPosition = Math.max(from, to + 1);
			return new StreamPage(List.copyOf(page), nextPosition, nextPosition > lastPosition);
		} finally {
			lock.readLock().unlock();
		}
	}

	@Override
	public void appendToStream(String streamName, long expectedVersion, List<EventEnvelope> envelopes) {
		append(streamName, expectedVersion, envelopes);
	}

	private void append(String streamName, long expectedVersion, List<EventEnvelope> envelopes) {
		lock.writeLock().lock();
		try {
			StoredStream stream = streams.get(streamName);
			if (stream != null && stream.deleted) {
				throw new AggregateDeletedException(streamName);
			}
			checkExpectedVersion(streamName, stream, expectedVersion);
			if (envelopes.isEmpty()) {
				return;
			}
			if (stream == null) {
				stream = new StoredStream();
				streams.put(streamName, stream);
			}
			for (EventEnvelope envelope : envelopes) {
				long position = stream.events.size() + 1L;
				stream.events.add(new RecordedEnvelope(streamName, position, envelope.eventId(), envelope.eventType(),
						envelope.payload(), envelope.metadata()));
			}
			log.trace("[InMemoryStore] {} 追加 {} 筆，目前版本 {}", streamName, envelopes.size(), stream.events.size());
		} finally {
			lock.writeLock().unlock();
		}
	}

	@Override
	public StreamTransaction startTransaction(String streamName, long expectedVersion) {
		return new InMemoryTransaction(streamName, expectedVersion);
	}

	/**
	 * 刪除 Stream 並留下墓碑
	 */
	public void deleteStream(String streamName) {
		lock.writeLock().lock();
		try {
			streams.computeIfAbsent(streamName, name -> new StoredStream()).deleted = true;
			log.info("[InMemoryStore] Stream {} 已刪除", streamName);
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	 * @return Stream 目前版本，不存在時為 {@link ExpectedVersion#NO_STREAM}
	 */
	public long currentVersion(String streamName) {
		lock.readLock().lock();
		try {
			StoredStream stream = streams.get(streamName);
			return stream == null ? ExpectedVersion.NO_STREAM : stream.events.size();
		} finally {
			lock.readLock().unlock();
		}
	}

	private StoredStream existingStream(String streamName) {
		StoredStream stream = streams.get(streamName);
		if (stream == null) {
			throw new AggregateNotFoundException(streamName);
		}
		if (stream.deleted) {
			throw new AggregateDeletedException(streamName);
		}
		return stream;
	}

	private void checkExpectedVersion(String streamName, StoredStream stream, long expectedVersion) {
		if (expectedVersion == ExpectedVersion.ANY) {
			return;
		}
		long currentVersion = stream == null ? ExpectedVersion.NO_STREAM : stream.events.size();
		if (currentVersion != expectedVersion) {
			throw new ConcurrencyConflictException(streamName, expectedVersion,
					"Stream " + streamName + " 預期版本 " + expectedVersion + "，實際版本 " + currentVersion);
		}
	}

	private static final class StoredStream {
		private final List<RecordedEnvelope> events = new ArrayList<>();
		private boolean deleted;
	}

	private final class InMemoryTransaction implements StreamTransaction {

		private final String streamName;
		private final long expectedVersion;
		private final List<EventEnvelope> pending = new ArrayList<>();
		private boolean completed;

		private InMemoryTransaction(String streamName, long expectedVersion) {
			this.streamName = streamName;
			this.expectedVersion = expectedVersion;
		}

		@Override
		public void write(List<EventEnvelope> envelopes) {
			ensureOpen();
			pending.addAll(envelopes);
		}

		@Override
		public void commit() {
			ensureOpen();
			completed = true;
			append(streamName, expectedVersion, pending);
		}

		@Override
		public void rollback() {
			completed = true;
			pending.clear();
		}

		private void ensureOpen() {
			if (completed) {
				throw new IllegalStateException("交易已結束: " + streamName);
			}
		}
	}
}

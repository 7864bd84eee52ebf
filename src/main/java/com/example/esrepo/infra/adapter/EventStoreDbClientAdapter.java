package com.example.esrepo.infra.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ExpectedRevision;
import com.eventstore.dbclient.MaximumAppendSizeExceededException;
import com.eventstore.dbclient.ReadResult;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.StreamDeletedException;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WrongExpectedVersionException;
import com.example.esrepo.application.exception.AggregateDeletedException;
import com.example.esrepo.application.exception.AggregateNotFoundException;
import com.example.esrepo.application.exception.AppendSizeExceededException;
import com.example.esrepo.application.exception.ConcurrencyConflictException;
import com.example.esrepo.application.exception.EventStoreAccessException;
import com.example.esrepo.application.exception.RepositoryOperationCancelledException;
import com.example.esrepo.application.port.store.EventEnvelope;
import com.example.esrepo.application.port.store.EventStoreClientPort;
import com.example.esrepo.application.port.store.ExpectedVersion;
import com.example.esrepo.application.port.store.RecordedEnvelope;
import com.example.esrepo.application.port.store.StreamPage;
import com.example.esrepo.application.port.store.StreamTransaction;
import com.example.esrepo.infra.event.mapper.EventStoreEventMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * EventStoreDB gRPC 客戶端轉接器
 *
 * <p>
 * 將 {@link EventStoreClientPort} 的三個原語對應到 {@link EventStoreDBClient}：
 * </p>
 * <ul>
 * <li>順向讀取：{@code readStream} + {@code fromRevision / maxCount}</li>
 * <li>追加：{@code appendToStream} + {@link ExpectedRevision}</li>
 * <li>交易：gRPC 協定沒有多段交易，分頁先在客戶端暫存，commit 時以單次 {@code appendToStream}
 * 原子性寫入，commit 前讀者看不到任何分頁</li>
 * </ul>
 *
 * <p>
 * 限制：單次 {@code appendToStream} 受伺服器 {@code MaxAppendSize} 限制 (預設 1 MiB)，交易也不例外。
 * 一次 Save 數萬筆事件需調高伺服器設定，超過時回報 {@link AppendSizeExceededException}，整批不寫入。
 * </p>
 *
 * <p>
 * 逾時與重試屬於 {@link EventStoreDBClient} 的設定，這裡一律阻塞等待結果。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class EventStoreDbClientAdapter implements EventStoreClientPort {

	private final EventStoreDBClient client;
	private final EventStoreEventMapper mapper;

	@Override
	public StreamPage readStreamForward(String streamName, long startPosition, int count, boolean resolveLinks) {
		ReadStreamOptions options = ReadStreamOptions.get()
				.forwards()
				.fromRevision(EventStoreEventMapper.toRevision(startPosition))
				.maxCount(count);
		options = resolveLinks ? options.resolveLinkTos() : options.notResolveLinkTos();

		ReadResult result = await(client.readStream(streamName, options), streamName, ExpectedVersion.ANY);
		List<RecordedEnvelope> events = result.getEvents()
				.stream()
				.map(resolvedEvent -> mapper.toRecordedEnvelope(streamName, resolvedEvent))
				.toList();

		long nextPosition = events.isEmpty() ? startPosition : events.get(events.size() - 1).position() + 1;
		boolean endOfStream = events.size() < count;
		log.debug("[EventStoreDB] 讀取 {} 從 {} 起 {} 筆 (end={})", streamName, startPosition, events.size(),
				endOfStream);
		return new StreamPage(events, nextPosition, endOfStream);
	}

	@Override
	public void appendToStream(String streamName, long expectedVersion, List<EventEnvelope> envelopes) {
		append(streamName, expectedVersion, envelopes);
	}

	private void append(String streamName, long expectedVersion, List<EventEnvelope> envelopes) {
		AppendToStreamOptions options = AppendToStreamOptions.get().expectedRevision(toExpectedRevision(expectedVersion));
		List<EventData> eventData = envelopes.stream().map(mapper::toEventData).toList();
		await(client.appendToStream(streamName, options, eventData.iterator()), streamName, expectedVersion);
	}

	@Override
	public StreamTransaction startTransaction(String streamName, long expectedVersion) {
		return new BufferedTransaction(streamName, expectedVersion);
	}

	static ExpectedRevision toExpectedRevision(long expectedVersion) {
		if (expectedVersion == ExpectedVersion.NO_STREAM) {
			return ExpectedRevision.noStream();
		}
		if (expectedVersion == ExpectedVersion.ANY) {
			return ExpectedRevision.any();
		}
		return ExpectedRevision.expectedRevision(EventStoreEventMapper.toRevision(expectedVersion));
	}

	private <T> T await(CompletableFuture<T> future, String streamName, long expectedVersion) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RepositoryOperationCancelledException("等待 EventStoreDB 回應時被中斷: " + streamName, e);
		} catch (ExecutionException e) {
			throw translate(e.getCause() != null ? e.getCause() : e, streamName, expectedVersion);
		}
	}

	private RuntimeException translate(Throwable cause, String streamName, long expectedVersion) {
		if (cause instanceof StreamNotFoundException) {
			return new AggregateNotFoundException(streamName, cause);
		}
		if (cause instanceof StreamDeletedException) {
			return new AggregateDeletedException(streamName, cause);
		}
		if (cause instanceof MaximumAppendSizeExceededException) {
			log.warn("[EventStoreDB] {} 單次寫入超過伺服器 MaxAppendSize", streamName);
			return new AppendSizeExceededException(streamName, cause);
		}
		if (cause instanceof WrongExpectedVersionException) {
			log.warn("[EventStoreDB] {} 預期版本 {} 不符: {}", streamName, expectedVersion, cause.getMessage());
			return new ConcurrencyConflictException(streamName, expectedVersion,
					"Stream " + streamName + " 預期版本 " + expectedVersion + " 不符", cause);
		}
		return new EventStoreAccessException("EventStoreDB 操作失敗: " + streamName, cause);
	}

	/**
	 * 客戶端暫存的分頁交易
	 */
	private final class BufferedTransaction implements StreamTransaction {

		private final String streamName;
		private final long expectedVersion;
		private final List<EventEnvelope> pending = new ArrayList<>();
		private boolean completed;

		private BufferedTransaction(String streamName, long expectedVersion) {
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
			pending.clear();
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

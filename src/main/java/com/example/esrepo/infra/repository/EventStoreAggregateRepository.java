package com.example.esrepo.infra.repository;

import java.util.List;
import java.util.UUID;

import com.example.esrepo.application.domain.aggregate.EventSourcedAggregate;
import com.example.esrepo.application.exception.AggregateConstructionException;
import com.example.esrepo.application.port.AggregateRepositoryPort;
import com.example.esrepo.application.port.CommitHeaders;
import com.example.esrepo.application.port.CommitHeadersCustomizer;
import com.example.esrepo.application.port.store.EventEnvelope;
import com.example.esrepo.infra.aggregate.AggregateFactory;
import com.example.esrepo.infra.event.codec.EncodedEvent;
import com.example.esrepo.infra.event.codec.EventJsonCodec;
import com.example.esrepo.infra.event.naming.StreamNameStrategy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 事件溯源聚合根倉儲
 *
 * <p>
 * 組合 命名策略、聚合根工廠、分頁重播器、編解碼器與寫入規劃器。本身不持有可變共享狀態，
 * 可被多執行緒同時用於不同聚合根；同一 Stream 的並行寫入由儲存端的樂觀鎖序列化。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class EventStoreAggregateRepository implements AggregateRepositoryPort {

	private final StreamNameStrategy streamNameStrategy;
	private final AggregateFactory aggregateFactory;
	private final EventJsonCodec codec;
	private final PaginatedStreamReader reader;
	private final EventWritePlanner writePlanner;

	@Override
	public <A extends EventSourcedAggregate> A getById(Class<A> aggregateType, UUID id) {
		String streamName = streamNameStrategy.streamNameFor(aggregateType, id);
		A aggregate = construct(aggregateType, streamName);
		return reader.replay(streamName, aggregate);
	}

	@Override
	public <A extends EventSourcedAggregate> A getById(Class<A> aggregateType, UUID id, long version) {
		String streamName = streamNameStrategy.streamNameFor(aggregateType, id);
		A aggregate = construct(aggregateType, streamName);
		return reader.replay(streamName, aggregate, version);
	}

	@Override
	public void save(EventSourcedAggregate aggregate, UUID commitId, CommitHeadersCustomizer customizer) {
		if (aggregate.getId() == null) {
			throw new IllegalStateException("聚合根 ID 不可為空: " + aggregate.getClass().getName());
		}

		CommitHeaders commitHeaders = CommitHeaders.create(commitId, aggregate.getClass().getName());
		customizer.customize(commitHeaders);

		String streamName = streamNameStrategy.streamNameFor(aggregate.getClass(), aggregate.getId());
		List<Object> newEvents = aggregate.getUncommittedEvents();
		long originalVersion = aggregate.getVersion() - newEvents.size();
		if (originalVersion < 0) {
			throw new IllegalStateException("聚合根 " + streamName + " 的未提交事件數 (" + newEvents.size() + ") 大於版本 ("
					+ aggregate.getVersion() + ")");
		}

		List<EventEnvelope> envelopes = newEvents.stream()
				.map(event -> toEnvelope(event, commitHeaders))
				.toList();

		writePlanner.write(streamName, originalVersion, envelopes);
		aggregate.clearUncommittedEvents();

		if (!envelopes.isEmpty()) {
			log.info(">>> [Save] Stream {} 已寫入 {} 筆事件 (commitId={}, 版本 {} -> {})", streamName, envelopes.size(),
					commitId, originalVersion, aggregate.getVersion());
		}
	}

	private <A extends EventSourcedAggregate> A construct(Class<A> aggregateType, String streamName) {
		try {
			return aggregateFactory.construct(aggregateType);
		} catch (AggregateConstructionException e) {
			throw new AggregateConstructionException("Stream " + streamName + " 無法建立聚合根: " + e.getMessage(), e);
		}
	}

	private EventEnvelope toEnvelope(Object event, CommitHeaders commitHeaders) {
		EncodedEvent encoded = codec.encode(event, commitHeaders.asMap());
		return new EventEnvelope(UUID.randomUUID(), encoded.eventType(), encoded.payload(), encoded.metadata());
	}
}

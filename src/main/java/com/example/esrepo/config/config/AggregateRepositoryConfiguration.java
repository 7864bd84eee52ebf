package com.example.esrepo.config.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import com.example.esrepo.application.port.AggregateRepositoryPort;
import com.example.esrepo.application.port.store.EventStoreClientPort;
import com.example.esrepo.infra.aggregate.AggregateFactory;
import com.example.esrepo.infra.event.codec.EventJsonCodec;
import com.example.esrepo.infra.event.naming.CamelCaseStreamNameStrategy;
import com.example.esrepo.infra.event.naming.StreamNameStrategy;
import com.example.esrepo.infra.repository.EventStoreAggregateRepository;
import com.example.esrepo.infra.repository.EventWritePlanner;
import com.example.esrepo.infra.repository.PaginatedStreamReader;

/**
 * 聚合根倉儲配置類
 * <p>
 * 可調參數僅有讀寫頁大小 (預設皆為 500) 與 Stream 命名策略。
 * </p>
 */
@AutoConfiguration(after = { EventStoreConfiguration.class, EventCodecConfiguration.class })
public class AggregateRepositoryConfiguration {

	@Value("${event-repository.read-page-size:500}")
	private int readPageSize;

	@Value("${event-repository.write-page-size:500}")
	private int writePageSize;

	/**
	 * 預設命名策略，宿主應用程式可自行定義同型別 Bean 覆寫
	 */
	@Bean
	@ConditionalOnMissingBean
	public StreamNameStrategy streamNameStrategy() {
		return new CamelCaseStreamNameStrategy();
	}

	@Bean
	public PaginatedStreamReader paginatedStreamReader(EventStoreClientPort eventStoreClientPort,
			EventJsonCodec eventJsonCodec) {
		return new PaginatedStreamReader(eventStoreClientPort, eventJsonCodec, readPageSize);
	}

	@Bean
	public EventWritePlanner eventWritePlanner(EventStoreClientPort eventStoreClientPort) {
		return new EventWritePlanner(eventStoreClientPort, writePageSize);
	}

	@Bean
	public AggregateRepositoryPort aggregateRepository(StreamNameStrategy streamNameStrategy,
			AggregateFactory aggregateFactory, EventJsonCodec eventJsonCodec, PaginatedStreamReader reader,
			EventWritePlanner writePlanner) {
		return new EventStoreAggregateRepository(streamNameStrategy, aggregateFactory, eventJsonCodec, reader,
				writePlanner);
	}
}

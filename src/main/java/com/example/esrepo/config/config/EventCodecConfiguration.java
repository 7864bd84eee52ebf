package com.example.esrepo.config.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import com.example.esrepo.infra.aggregate.AggregateFactory;
import com.example.esrepo.infra.event.codec.EventJsonCodec;
import com.example.esrepo.infra.event.codec.EventTypeRegistry;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 事件型別與聚合根重播建構子都由宿主應用程式透過 {@link EventSourcingRegistrations} Bean 於啟動時註冊。
 * 排在 Jackson 自動配置之後，宿主有 Spring Boot 管理的 {@link ObjectMapper} 時直接沿用。
 * </p>
 */
@AutoConfiguration(afterName = "org.springframework.boot.jackson.autoconfigure.JacksonAutoConfiguration")
public class EventCodecConfiguration {

	@Bean
	@ConditionalOnMissingBean
	public ObjectMapper objectMapper() {
		return JsonMapper.builder().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();
	}

	@Bean
	public EventTypeRegistry eventTypeRegistry(ObjectProvider<EventSourcingRegistrations> registrations) {
		EventTypeRegistry registry = new EventTypeRegistry();
		registrations.orderedStream().forEach(registration -> registration.registerEventTypes(registry));
		return registry;
	}

	@Bean
	public AggregateFactory aggregateFactory(ObjectProvider<EventSourcingRegistrations> registrations) {
		AggregateFactory factory = new AggregateFactory();
		registrations.orderedStream().forEach(registration -> registration.registerAggregates(factory));
		return factory;
	}

	@Bean
	public EventJsonCodec eventJsonCodec(ObjectMapper objectMapper, EventTypeRegistry eventTypeRegistry) {
		return new EventJsonCodec(objectMapper, eventTypeRegistry);
	}
}

package com.example.esrepo.config.config;

import com.example.esrepo.infra.aggregate.AggregateFactory;
import com.example.esrepo.infra.event.codec.EventTypeRegistry;

/**
 * 宿主應用程式提供的註冊點
 *
 * <pre>
 * &#64;Bean
 * EventSourcingRegistrations orderRegistrations() {
 * 	return new EventSourcingRegistrations() {
 * 		public void registerEventTypes(EventTypeRegistry registry) { registry.register(OrderPlaced.class); }
 * 		public void registerAggregates(AggregateFactory factory) { factory.register(Order.class, Order::replay); }
 * 	};
 * }
 * </pre>
 */
public interface EventSourcingRegistrations {

	void registerEventTypes(EventTypeRegistry registry);

	void registerAggregates(AggregateFactory factory);
}

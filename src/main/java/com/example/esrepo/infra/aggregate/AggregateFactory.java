package com.example.esrepo.infra.aggregate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import com.example.esrepo.application.domain.aggregate.EventSourcedAggregate;
import com.example.esrepo.application.exception.AggregateConstructionException;

import lombok.extern.slf4j.Slf4j;

/**
 * 聚合根工廠：為重播建立版本為 0 的空白實例
 *
 * <p>
 * 每個聚合根型別需註冊一個「重播建構子」({@link Supplier})，通常指向不會產生建立事件的
 * 非公開建構子。重播只能靠事件還原狀態，不可重新觸發業務建構邏輯。
 * </p>
 */
@Slf4j
public class AggregateFactory {

	private final Map<Class<?>, Supplier<? extends EventSourcedAggregate>> replayConstructors = new ConcurrentHashMap<>();

	public <A extends EventSourcedAggregate> AggregateFactory register(Class<A> aggregateType,
			Supplier<? extends A> replayConstructor) {
		replayConstructors.put(aggregateType, replayConstructor);
		log.debug("[AggregateFactory] 註冊重播建構子: {}", aggregateType.getName());
		return this;
	}

	public boolean supports(Class<?> aggregateType) {
		return replayConstructors.containsKey(aggregateType);
	}

	/**
	 * 建立空白聚合根
	 *
	 * @throws AggregateConstructionException 未註冊、建構失敗、回傳型別不符或版本不為 0
	 */
	public <A extends EventSourcedAggregate> A construct(Class<A> aggregateType) {
		Supplier<? extends EventSourcedAggregate> constructor = replayConstructors.get(aggregateType);
		if (constructor == null) {
			throw new AggregateConstructionException("聚合根型別未註冊重播建構子: " + aggregateType.getName());
		}

		EventSourcedAggregate instance;
		try {
			instance = constructor.get();
		} catch (RuntimeException e) {
			throw new AggregateConstructionException("聚合根建構失敗: " + aggregateType.getName(), e);
		}

		if (!aggregateType.isInstance(instance)) {
			throw new AggregateConstructionException(
					"重播建構子回傳型別不符: 預期 " + aggregateType.getName() + "，實際 "
							+ (instance == null ? "null" : instance.getClass().getName()));
		}
		if (instance.getVersion() != 0 || !instance.getUncommittedEvents().isEmpty()) {
			throw new AggregateConstructionException(
					"重播建構子必須回傳未套用任何事件的實例: " + aggregateType.getName());
		}
		return aggregateType.cast(instance);
	}
}

package com.example.esrepo.application.domain.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * 聚合根基底類別
 * <p>
 * 子類別在建構子中以 {@link #register(Class, Consumer)} 登記「事件型別 → 狀態變更」的處理器，
 * 業務方法則以 {@link #raiseEvent(Object)} 產生新事件。重播與業務操作共用同一條套用路徑，
 * 因此版本號永遠等於已套用事件數。
 * </p>
 *
 * <pre>
 * public class Order extends AggregateRoot {
 * 	public Order(UUID id) { this(); raiseEvent(new OrderPlaced(id)); }
 * 	private Order() { register(OrderPlaced.class, e -&gt; id = e.getOrderId()); }
 * }
 * </pre>
 */
public abstract class AggregateRoot implements EventSourcedAggregate {

	private final Map<Class<?>, Consumer<Object>> handlers = new HashMap<>();
	private final List<Object> uncommittedEvents = new ArrayList<>();

	protected UUID id;
	private long version;

	@Override
	public UUID getId() {
		return id;
	}

	@Override
	public long getVersion() {
		return version;
	}

	/**
	 * 登記事件處理器，同一型別重複登記時以後者為準
	 */
	protected <E> void register(Class<E> eventType, Consumer<? super E> handler) {
		handlers.put(eventType, event -> handler.accept(eventType.cast(event)));
	}

	@Override
	public void applyEvent(Object event) {
		Consumer<Object> handler = handlers.get(event.getClass());
		if (handler == null) {
			throw new IllegalStateException(
					getClass().getSimpleName() + " 未登記事件處理器: " + event.getClass().getSimpleName());
		}
		handler.accept(event);
		version++;
	}

	/**
	 * 業務操作產生新事件：先套用至自身狀態，再放入未提交緩衝區
	 */
	protected void raiseEvent(Object event) {
		applyEvent(event);
		uncommittedEvents.add(event);
	}

	@Override
	public List<Object> getUncommittedEvents() {
		return Collections.unmodifiableList(new ArrayList<>(uncommittedEvents));
	}

	@Override
	public void clearUncommittedEvents() {
		uncommittedEvents.clear();
	}
}

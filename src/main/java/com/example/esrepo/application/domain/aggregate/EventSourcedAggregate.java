package com.example.esrepo.application.domain.aggregate;

import java.util.List;
import java.util.UUID;

/**
 * 事件溯源聚合根的最小契約
 * <p>
 * 倉儲只透過這組方法讀寫聚合根，呼叫結束後不保留任何參考。
 * </p>
 */
public interface EventSourcedAggregate {

	/**
	 * 聚合根唯一識別碼
	 */
	UUID getId();

	/**
	 * 自建構以來已套用的 Domain Event 數量 (不含 Stream 建立標記)
	 */
	long getVersion();

	/**
	 * 套用一筆事件 (重播或新產生的事件皆走此入口)，並遞增版本
	 *
	 * @param event Domain Event
	 */
	void applyEvent(Object event);

	/**
	 * 自上次儲存以來產生、尚未寫入的事件，依產生順序排列
	 *
	 * @return 唯讀副本
	 */
	List<Object> getUncommittedEvents();

	/**
	 * 寫入成功後清除未提交事件
	 */
	void clearUncommittedEvents();
}

package com.example.esrepo.infra.event.naming;

import java.util.UUID;

/**
 * (聚合根型別, 識別碼) → Stream 名稱
 * <p>
 * Stream 名稱是讀寫事件的唯一定址鍵，實作必須是純函式且跨程序重啟保持穩定。
 * </p>
 */
@FunctionalInterface
public interface StreamNameStrategy {

	String streamNameFor(Class<?> aggregateType, UUID aggregateId);
}

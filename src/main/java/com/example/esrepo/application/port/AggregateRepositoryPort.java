package com.example.esrepo.application.port;

import java.util.UUID;

import com.example.esrepo.application.domain.aggregate.EventSourcedAggregate;

/**
 * 聚合根倉儲 Port
 */
public interface AggregateRepositoryPort {

	/**
	 * 重播 Stream 全部事件取得最新狀態的聚合根
	 *
	 * @param aggregateType 聚合根型別
	 * @param id            聚合根唯一值
	 * @throws com.example.esrepo.application.exception.AggregateNotFoundException Stream 不存在
	 * @throws com.example.esrepo.application.exception.AggregateDeletedException  Stream 已刪除
	 */
	<A extends EventSourcedAggregate> A getById(Class<A> aggregateType, UUID id);

	/**
	 * 只重播到指定版本 (含)
	 *
	 * @param version 目標版本，必須大於 0
	 * @throws com.example.esrepo.application.exception.VersionNotFoundException Stream 長度不足
	 */
	<A extends EventSourcedAggregate> A getById(Class<A> aggregateType, UUID id, long version);

	/**
	 * 寫入聚合根的未提交事件，成功後清空緩衝區
	 *
	 * @param aggregate  聚合根
	 * @param commitId   提交識別碼，供重試時比對
	 * @param customizer 自訂標頭擴充
	 * @throws com.example.esrepo.application.exception.ConcurrencyConflictException 預期版本不符
	 */
	void save(EventSourcedAggregate aggregate, UUID commitId, CommitHeadersCustomizer customizer);

	default void save(EventSourcedAggregate aggregate, UUID commitId) {
		save(aggregate, commitId, CommitHeadersCustomizer.NONE);
	}
}

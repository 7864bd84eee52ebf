package com.example.esrepo.infra.repository;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import com.example.esrepo.application.domain.aggregate.EventSourcedAggregate;
import com.example.esrepo.application.port.AggregateRepositoryPort;
import com.example.esrepo.application.port.CommitHeadersCustomizer;

import lombok.RequiredArgsConstructor;

/**
 * 非同步倉儲：將每個操作包成可獨立等待的 {@link CompletableFuture}
 * <p>
 * 不重試、不設逾時；失敗時 future 以原始例外 (包在 CompletionException 內) 結束。
 * 若要中止長時間的重播或分頁寫入，需中斷實際執行的執行緒 (例如 {@code ExecutorService#shutdownNow()})，
 * 倉儲會在頁與頁之間檢查中斷。
 * </p>
 */
@RequiredArgsConstructor
public class AsyncAggregateRepository {

	private final AggregateRepositoryPort delegate;
	private final Executor executor;

	public <A extends EventSourcedAggregate> CompletableFuture<A> getById(Class<A> aggregateType, UUID id) {
		return CompletableFuture.supplyAsync(() -> delegate.getById(aggregateType, id), executor);
	}

	public <A extends EventSourcedAggregate> CompletableFuture<A> getById(Class<A> aggregateType, UUID id,
			long version) {
		return CompletableFuture.supplyAsync(() -> delegate.getById(aggregateType, id, version), executor);
	}

	public CompletableFuture<Void> save(EventSourcedAggregate aggregate, UUID commitId,
			CommitHeadersCustomizer customizer) {
		return CompletableFuture.runAsync(() -> delegate.save(aggregate, commitId, customizer), executor);
	}

	public CompletableFuture<Void> save(EventSourcedAggregate aggregate, UUID commitId) {
		return save(aggregate, commitId, CommitHeadersCustomizer.NONE);
	}
}

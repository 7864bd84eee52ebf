package com.example.esrepo.infra.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.example.esrepo.application.domain.aggregate.EventSourcedAggregate;
import com.example.esrepo.application.exception.AggregateConstructionException;
import com.example.esrepo.application.exception.AggregateDeletedException;
import com.example.esrepo.application.exception.AggregateNotFoundException;
import com.example.esrepo.application.exception.ConcurrencyConflictException;
import com.example.esrepo.application.exception.VersionNotFoundException;
import com.example.esrepo.application.port.CommitHeaders;
import com.example.esrepo.application.port.store.ExpectedVersion;
import com.example.esrepo.application.port.store.RecordedEnvelope;
import com.example.esrepo.infra.adapter.InMemoryEventStoreClient;
import com.example.esrepo.infra.aggregate.AggregateFactory;
import com.example.esrepo.infra.event.codec.EventJsonCodec;
import com.example.esrepo.infra.event.naming.CamelCaseStreamNameStrategy;
import com.example.esrepo.support.RepositoryFixture;
import com.example.esrepo.support.SampleValueRecorded;
import com.example.esrepo.support.TestAggregate;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>聚合根倉儲整合測試</h1>
 *
 * <pre>
 * <b>Feature:</b> 以分頁重播重建聚合根，並以樂觀鎖寫回新事件
 * <b>Given</b> 記憶體事件儲存 (讀寫頁大小皆為 500)
 * <b>When</b>  儲存 N 筆事件後再依 ID 或指定版本載入
 * <b>Then</b>  重建結果與頁數無關，版本等於實際套用的事件數
 * </pre>
 */
@Slf4j
class EventStoreAggregateRepositoryTest {

	private InMemoryEventStoreClient client;
	private EventStoreAggregateRepository repository;
	private final EventJsonCodec codec = RepositoryFixture.codec();

	@BeforeEach
	void setUp() {
		client = spy(new InMemoryEventStoreClient());
		repository = RepositoryFixture.repository(client);
	}

	@ParameterizedTest(name = "儲存 {0} 筆事件後可完整重播")
	@ValueSource(ints = { 0, 1, 500, 1500, 50000 })
	void canGetLatestVersionById(int numberOfEvents) {
		UUID id = saveNewAggregate(numberOfEvents);

		TestAggregate retrieved = repository.getById(TestAggregate.class, id);

		assertThat(retrieved.getId()).isEqualTo(id);
		assertThat(retrieved.getAppliedEventCount()).isEqualTo(numberOfEvents);
		assertThat(retrieved.getVersion()).isEqualTo(numberOfEvents + 1L);
		assertThat(retrieved.getUncommittedEvents()).isEmpty();
	}

	@Test
	@DisplayName("指定版本落在第一頁")
	void canGetSpecificVersionFromFirstPageById() {
		UUID id = saveNewAggregate(100);

		TestAggregate retrieved = repository.getById(TestAggregate.class, id, 65);

		assertThat(retrieved.getAppliedEventCount()).isEqualTo(64);
		assertThat(retrieved.getVersion()).isEqualTo(65);
	}

	@Test
	void canGetSpecificVersionFromSubsequentPageById() {
		UUID id = saveNewAggregate(1500);

		assertThat(repository.getById(TestAggregate.class, id, 126).getAppliedEventCount()).isEqualTo(125);
		assertThat(repository.getById(TestAggregate.class, id, 1001).getAppliedEventCount()).isEqualTo(1000);
		assertThat(repository.getById(TestAggregate.class, id, 501).getAppliedEventCount()).isEqualTo(500);
	}

	@Test
	void versionBeyondStreamLengthIsVersionNotFound() {
		UUID id = saveNewAggregate(10);

		assertThatThrownBy(() -> repository.getById(TestAggregate.class, id, 12))
				.isInstanceOf(VersionNotFoundException.class);
	}

	@Test
	void neverWrittenIdIsNotFound() {
		assertThatThrownBy(() -> repository.getById(TestAggregate.class, UUID.randomUUID()))
				.isInstanceOf(AggregateNotFoundException.class);
		assertThatThrownBy(() -> repository.getById(TestAggregate.class, UUID.randomUUID(), 1))
				.isInstanceOf(AggregateNotFoundException.class);
	}

	@Test
	void tombstonedStreamIsDeleted() {
		UUID id = saveNewAggregate(3);
		client.deleteStream(streamName(id));

		assertThatThrownBy(() -> repository.getById(TestAggregate.class, id))
				.isInstanceOf(AggregateDeletedException.class);
	}

	@Test
	@DisplayName("少於寫入頁大小走單次 append，達到頁大小改走分頁交易")
	void choosesWritePathByBatchSize() {
		UUID small = saveNewAggregate(498);
		verify(client).appendToStream(eq(streamName(small)), eq(ExpectedVersion.NO_STREAM), anyList());
		verify(client, never()).startTransaction(anyString(), anyLong());

		UUID large = saveNewAggregate(499);
		verify(client).startTransaction(streamName(large), ExpectedVersion.NO_STREAM);
		assertThat(client.currentVersion(streamName(large))).isEqualTo(500);
	}

	@Test
	void canSaveExistingAggregate() {
		UUID id = saveNewAggregate(100);

		TestAggregate firstSaved = repository.getById(TestAggregate.class, id);
		firstSaved.produceEvents(50);
		repository.save(firstSaved, UUID.randomUUID());

		TestAggregate secondSaved = repository.getById(TestAggregate.class, id);
		assertThat(secondSaved.getAppliedEventCount()).isEqualTo(150);
		verify(client).appendToStream(eq(streamName(id)), eq(101L), anyList());
	}

	@Test
	@DisplayName("兩次獨立載入依序修改並儲存，最後一次載入包含全部事件")
	void sequentialSavesFromIndependentLoadsBothSucceed() {
		UUID id = saveNewAggregate(10);

		TestAggregate first = repository.getById(TestAggregate.class, id);
		first.produceEvents(4);
		repository.save(first, UUID.randomUUID());

		TestAggregate second = repository.getById(TestAggregate.class, id);
		second.produceEvents(6);
		repository.save(second, UUID.randomUUID());

		assertThat(repository.getById(TestAggregate.class, id).getAppliedEventCount()).isEqualTo(20);
	}

	@Test
	@DisplayName("以過期副本儲存會產生樂觀鎖衝突，且不清除未提交事件")
	void staleCopyRaisesConcurrencyConflict() {
		UUID id = saveNewAggregate(10);
		TestAggregate winner = repository.getById(TestAggregate.class, id);
		TestAggregate stale = repository.getById(TestAggregate.class, id);

		winner.produceEvents(1);
		repository.save(winner, UUID.randomUUID());

		stale.produceEvents(2);
		assertThatThrownBy(() -> repository.save(stale, UUID.randomUUID()))
				.isInstanceOf(ConcurrencyConflictException.class);
		assertThat(stale.getUncommittedEvents()).hasSize(2);
		assertThat(repository.getById(TestAggregate.class, id).getAppliedEventCount()).isEqualTo(11);
	}

	@Test
	void savingNewAggregateTwiceConflicts() {
		UUID id = UUID.randomUUID();
		TestAggregate original = new TestAggregate(id);
		TestAggregate duplicate = new TestAggregate(id);
		repository.save(original, UUID.randomUUID());

		assertThatThrownBy(() -> repository.save(duplicate, UUID.randomUUID()))
				.isInstanceOf(ConcurrencyConflictException.class);
	}

	@Test
	void clearsEventsFromAggregateOnceCommitted() {
		TestAggregate aggregate = new TestAggregate(UUID.randomUUID());
		aggregate.produceEvents(10);

		repository.save(aggregate, UUID.randomUUID());

		assertThat(aggregate.getUncommittedEvents()).isEmpty();
		assertThat(aggregate.getVersion()).isEqualTo(11);
	}

	@Test
	void repeatedSaveWithoutNewEventsWritesNothing() {
		TestAggregate aggregate = new TestAggregate(UUID.randomUUID());
		aggregate.produceEvents(3);
		repository.save(aggregate, UUID.randomUUID());
		clearInvocations(client);

		repository.save(aggregate, UUID.randomUUID());

		verifyNoInteractions(client);
		assertThat(client.currentVersion(streamName(aggregate.getId()))).isEqualTo(4);
	}

	@Test
	void getsEventsFromCorrectStreams() {
		UUID first = saveNewAggregate(100);
		UUID second = saveNewAggregate(50);

		assertThat(repository.getById(TestAggregate.class, first).getAppliedEventCount()).isEqualTo(100);
		assertThat(repository.getById(TestAggregate.class, second).getAppliedEventCount()).isEqualTo(50);
	}

	@Test
	@DisplayName("同一次 Save 的每筆事件都帶有相同的 CommitId 與自訂標頭")
	void savesCommitHeadersOnEachEvent() {
		UUID commitId = UUID.randomUUID();
		TestAggregate aggregate = new TestAggregate(UUID.randomUUID());
		aggregate.produceEvents(20);

		repository.save(aggregate, commitId, headers -> headers
				.put("CustomHeader1", "CustomValue1")
				.put("CustomHeader2", "CustomValue2"));

		List<RecordedEnvelope> stored = client.readStreamForward(streamName(aggregate.getId()), 1, 21, false).events();
		assertThat(stored).hasSize(21);
		Set<UUID> eventIds = new HashSet<>();
		for (RecordedEnvelope envelope : stored) {
			Map<String, Object> headers = codec.readHeaders(envelope.metadata());
			assertThat(headers)
					.containsEntry(CommitHeaders.COMMIT_ID, commitId.toString())
					.containsEntry(CommitHeaders.AGGREGATE_TYPE_NAME, TestAggregate.class.getName())
					.containsEntry(CommitHeaders.EVENT_TYPE_NAME, envelope.eventType())
					.containsEntry("CustomHeader1", "CustomValue1")
					.containsEntry("CustomHeader2", "CustomValue2");
			eventIds.add(envelope.eventId());
		}
		assertThat(eventIds).hasSize(21);
		assertThat(codec.decode(stored.get(1).metadata(), stored.get(1).payload()))
				.isEqualTo(new SampleValueRecorded("first-0", "second-0"));
	}

	@Test
	void customizerCannotReplaceRequiredHeaders() {
		TestAggregate aggregate = new TestAggregate(UUID.randomUUID());

		assertThatThrownBy(() -> repository.save(aggregate, UUID.randomUUID(),
				headers -> headers.put(CommitHeaders.COMMIT_ID, "forged")))
				.isInstanceOf(IllegalArgumentException.class);
		verifyNoInteractions(client);
		assertThat(aggregate.getUncommittedEvents()).hasSize(1);
	}

	@Test
	@DisplayName("未提交事件數大於版本屬於不可能的狀態，寫入前即拒絕")
	void rejectsAggregateWithMoreUncommittedEventsThanVersion() {
		EventSourcedAggregate broken = new BrokenAggregate();

		assertThatThrownBy(() -> repository.save(broken, UUID.randomUUID()))
				.isInstanceOf(IllegalStateException.class);
		verifyNoInteractions(client);
	}

	@Test
	void honoursInjectedStreamNaming() {
		EventStoreAggregateRepository custom = new EventStoreAggregateRepository(
				(type, id) -> "custom_" + id, RepositoryFixture.aggregateFactory(), codec,
				new PaginatedStreamReader(client, codec, 500), new EventWritePlanner(client, 500));
		TestAggregate aggregate = new TestAggregate(UUID.randomUUID());

		custom.save(aggregate, UUID.randomUUID());

		assertThat(client.currentVersion("custom_" + aggregate.getId())).isEqualTo(1);
		assertThat(custom.getById(TestAggregate.class, aggregate.getId()).getId()).isEqualTo(aggregate.getId());
	}

	@Test
	@DisplayName("聚合根無法建立時，錯誤訊息帶有 Stream 名稱且不讀取儲存端")
	void constructionFailureNamesTheStream() {
		UUID id = saveNewAggregate(1);
		EventStoreAggregateRepository unregistered = new EventStoreAggregateRepository(
				new CamelCaseStreamNameStrategy(), new AggregateFactory(), codec,
				new PaginatedStreamReader(client, codec, 500), new EventWritePlanner(client, 500));
		clearInvocations(client);

		assertThatThrownBy(() -> unregistered.getById(TestAggregate.class, id))
				.isInstanceOf(AggregateConstructionException.class)
				.hasMessageContaining(streamName(id))
				.hasMessageContaining(TestAggregate.class.getName());
		assertThatThrownBy(() -> unregistered.getById(TestAggregate.class, id, 1))
				.isInstanceOf(AggregateConstructionException.class)
				.hasMessageContaining(streamName(id));
		verifyNoInteractions(client);
	}

	private UUID saveNewAggregate(int numberOfEvents) {
		TestAggregate aggregate = new TestAggregate(UUID.randomUUID());
		aggregate.produceEvents(numberOfEvents);
		repository.save(aggregate, UUID.randomUUID());
		log.info(">>> [Given] 已儲存聚合根 {} ({} 筆事件，不含建立事件)", aggregate.getId(), numberOfEvents);
		return aggregate.getId();
	}

	private static String streamName(UUID id) {
		return new CamelCaseStreamNameStrategy().streamNameFor(TestAggregate.class, id);
	}

	/**
	 * 版本為 0 卻有未提交事件的異常聚合根
	 */
	private static final class BrokenAggregate implements EventSourcedAggregate {

		private final List<Object> uncommitted = new ArrayList<>(List.of(new SampleValueRecorded("a", "b")));

		@Override
		public UUID getId() {
			return UUID.randomUUID();
		}

		@Override
		public long getVersion() {
			return 0;
		}

		@Override
		public void applyEvent(Object event) {
		}

		@Override
		public List<Object> getUncommittedEvents() {
			return List.copyOf(uncommitted);
		}

		@Override
		public void clearUncommittedEvents() {
			uncommitted.clear();
		}
	}
}

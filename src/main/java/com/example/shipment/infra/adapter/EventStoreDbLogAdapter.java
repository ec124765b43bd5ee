package com.example.shipment.infra.adapter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ExpectedRevision;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WriteResult;
import com.eventstore.dbclient.WrongExpectedVersionException;
import com.example.shipment.application.port.EventLogPort;
import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.AppendResult;
import com.example.shipment.application.shared.eventsourcing.LogEventData;
import com.example.shipment.application.shared.eventsourcing.RecordedLogEvent;
import com.example.shipment.application.shared.exception.StorageUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * EventStoreDB 事件日誌轉接器 (Infrastructure Adapter)
 *
 * <p>
 * 封裝 EventStoreDB 專屬結構 ({@link EventData}, {@link ResolvedEvent}, {@link ExpectedRevision})，
 * 向上層只提供 {@link EventLogPort} 的語義。
 * </p>
 *
 * <h2>例外轉譯：</h2>
 * <ul>
 * <li>{@link WrongExpectedVersionException} → {@link AppendResult#conflict()}，衝突是回傳值而非例外</li>
 * <li>{@link StreamNotFoundException} → 串流不存在 (NO_STREAM / Optional.empty())</li>
 * <li>其他失敗 → {@link StorageUnavailableException}</li>
 * </ul>
 */
@Slf4j
public class EventStoreDbLogAdapter implements EventLogPort {

	private final EventStoreDBClient client;

	/**
	 * 正向讀取時每頁的事件筆數
	 */
	private final int pageSize;

	public EventStoreDbLogAdapter(EventStoreDBClient client, int pageSize) {
		if (pageSize <= 0) {
			throw new IllegalArgumentException("pageSize 必須大於 0");
		}
		this.client = client;
		this.pageSize = pageSize;
	}

	@Override
	public long currentRevision(String streamId) {
		ReadStreamOptions options = ReadStreamOptions.get().backwards().fromEnd().maxCount(1);
		try {
			List<ResolvedEvent> events = await(client.readStream(streamId, options), streamId).getEvents();
			if (events.isEmpty()) {
				return AggregateState.NO_STREAM;
			}
			return events.get(0).getEvent().getRevision();
		} catch (StreamNotFoundException e) {
			return AggregateState.NO_STREAM;
		}
	}

	@Override
	public Optional<Iterable<RecordedLogEvent>> readForward(String streamId, long fromRevision) {
		List<RecordedLogEvent> firstPage;
		try {
			firstPage = readPage(streamId, fromRevision);
		} catch (StreamNotFoundException e) {
			log.debug(">>> [EventStore] 串流 {} 不存在", streamId);
			return Optional.empty();
		}
		return Optional.of(() -> new PagedIterator(streamId, firstPage));
	}

	@Override
	public AppendResult appendConditional(String streamId, long expectedRevision, List<LogEventData> events) {
		ExpectedRevision expected = expectedRevision < 0 ? ExpectedRevision.noStream()
				: ExpectedRevision.expectedRevision(expectedRevision);
		AppendToStreamOptions options = AppendToStreamOptions.get().expectedRevision(expected);

		List<EventData> eventDataBatch = events.stream()
				.map(e -> EventData.builderAsJson(UUID.randomUUID(), e.typeTag(), e.payload()).build()).toList();

		try {
			WriteResult result = await(client.appendToStream(streamId, options, eventDataBatch.iterator()), streamId);
			long nextRevision = result.getNextExpectedRevision().toRawLong();
			log.debug(">>> [EventStore] 寫入成功: Stream={}, Revision={}", streamId, nextRevision);
			return AppendResult.applied(nextRevision);
		} catch (WrongExpectedVersionException e) {
			log.info(">>> [EventStore] 版本衝突: Stream={}, Expected={}", streamId, expectedRevision);
			return AppendResult.conflict();
		}
	}

	@Override
	public void close() {
		log.info(">>> [EventStore] 關閉 EventStoreDB 連線");
		client.shutdown();
	}

	private List<RecordedLogEvent> readPage(String streamId, long fromRevision) {
		ReadStreamOptions options = ReadStreamOptions.get().forwards().fromRevision(fromRevision).maxCount(pageSize);
		List<ResolvedEvent> events = await(client.readStream(streamId, options), streamId).getEvents();

		List<RecordedLogEvent> page = new ArrayList<>(events.size());
		for (ResolvedEvent resolved : events) {
			RecordedEvent event = resolved.getEvent();
			page.add(new RecordedLogEvent(event.getRevision(), event.getEventType(), event.getEventData()));
		}
		return page;
	}

	/**
	 * 等待 gRPC 呼叫完成
	 *
	 * <p>
	 * 不設定逾時；執行緒被中斷時取消請求並回復中斷旗標。 {@link StreamNotFoundException} 與
	 * {@link WrongExpectedVersionException} 原樣拋出交由呼叫端轉譯。
	 * </p>
	 */
	private <T> T await(CompletableFuture<T> future, String streamId) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			CancellationException cancelled = new CancellationException("EventStore 請求已取消: " + streamId);
			cancelled.initCause(e);
			throw cancelled;
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof StreamNotFoundException notFound) {
				throw notFound;
			}
			if (cause instanceof WrongExpectedVersionException wrongVersion) {
				throw wrongVersion;
			}
			throw new StorageUnavailableException("EventStore 存取失敗: " + streamId, cause);
		}
	}

	/**
	 * 分頁讀取的迭代器，第一頁於 readForward 時已讀取，後續頁面於迭代時才向 EventStore 請求
	 */
	private final class PagedIterator implements Iterator<RecordedLogEvent> {

		private final String streamId;
		private List<RecordedLogEvent> page;
		private int index;

		private PagedIterator(String streamId, List<RecordedLogEvent> firstPage) {
			this.streamId = streamId;
			this.page = firstPage;
		}

		@Override
		public boolean hasNext() {
			if (index < page.size()) {
				return true;
			}
			if (page.size() < pageSize) {
				return false;
			}
			long nextRevision = page.get(page.size() - 1).revision() + 1;
			try {
				page = readPage(streamId, nextRevision);
			} catch (StreamNotFoundException e) {
				throw new StorageUnavailableException("讀取途中串流消失: " + streamId, e);
			}
			index = 0;
			return !page.isEmpty();
		}

		@Override
		public RecordedLogEvent next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return page.get(index++);
		}
	}
}

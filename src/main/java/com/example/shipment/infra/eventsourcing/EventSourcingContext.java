package com.example.shipment.infra.eventsourcing;

import java.util.concurrent.Executor;
import java.util.function.Supplier;

import com.example.shipment.application.port.AggregateStoragePort;
import com.example.shipment.application.port.BlobStorePort;
import com.example.shipment.application.port.EventLogPort;
import com.example.shipment.application.port.SnapshotFailureListener;
import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.EventTypeRegistry;
import com.example.shipment.infra.adapter.EventSourcedStorageAdapter;
import com.example.shipment.infra.event.codec.JsonPayloadCodec;
import com.example.shipment.infra.event.mapper.DomainEventMapper;
import com.example.shipment.infra.persisence.impl.BlobSnapshotPersistence;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Event Sourcing 基礎設施上下文
 *
 * <p>
 * 集中持有事件日誌、Blob 儲存體、JSON 編解碼器與快照設定，由組態類別明確建立並傳入各個聚合的儲存轉接器。
 * 關閉時一併釋放事件日誌的連線。
 * </p>
 */
@Slf4j
@Getter
public class EventSourcingContext implements AutoCloseable {

	private final EventLogPort eventLog;
	private final BlobStorePort blobStore;
	private final JsonPayloadCodec codec;

	/**
	 * 串流最後序號 (revision，即串流長度 - 1) 超過此值才會讀寫快照
	 */
	private final long snapshotThreshold;

	/**
	 * 快照所在的 Blob container
	 */
	private final String snapshotContainer;

	private final Executor compactionExecutor;
	private final SnapshotFailureListener failureListener;

	@Builder
	private EventSourcingContext(EventLogPort eventLog, BlobStorePort blobStore, JsonPayloadCodec codec,
			long snapshotThreshold, String snapshotContainer, Executor compactionExecutor,
			SnapshotFailureListener failureListener) {
		if (eventLog == null || blobStore == null || codec == null) {
			throw new IllegalArgumentException("eventLog、blobStore 與 codec 不可為空");
		}
		this.eventLog = eventLog;
		this.blobStore = blobStore;
		this.codec = codec;
		this.snapshotThreshold = snapshotThreshold;
		this.snapshotContainer = snapshotContainer != null ? snapshotContainer : "snapshots";
		this.compactionExecutor = compactionExecutor != null ? compactionExecutor : Runnable::run;
		this.failureListener = failureListener != null ? failureListener : new LoggingSnapshotFailureListener();
	}

	/**
	 * 為指定的聚合狀態型別組裝儲存轉接器
	 *
	 * @param stateType    狀態類別，其 simple name 作為快照鍵的型別標籤
	 * @param defaultState 預設狀態工廠
	 * @param registry     可重播的事件型別
	 */
	public <S extends AggregateState> AggregateStoragePort<S> storageFor(Class<S> stateType,
			Supplier<S> defaultState, EventTypeRegistry<S> registry) {
		DomainEventMapper<S> mapper = new DomainEventMapper<>(codec, registry);
		BlobSnapshotPersistence<S> snapshots = new BlobSnapshotPersistence<>(blobStore, codec, snapshotContainer,
				stateType);
		SnapshotCompactor<S> compactor = new SnapshotCompactor<>(snapshots, snapshotThreshold, compactionExecutor,
				failureListener);

		EventReplayer<S> replayer = new EventReplayer<>(eventLog, snapshots, mapper, defaultState, snapshotThreshold);
		OptimisticAppender<S> appender = new OptimisticAppender<>(eventLog, mapper, compactor, codec, stateType);

		log.info(">>> [EventSourcing] 已建立 {} 的儲存轉接器 (快照門檻: {}, 事件型別: {})", stateType.getSimpleName(),
				snapshotThreshold, registry.typeTags());
		return new EventSourcedStorageAdapter<>(replayer, appender, defaultState);
	}

	@Override
	public void close() {
		eventLog.close();
	}
}

package com.example.shipment.infra.eventsourcing;

import java.util.Optional;
import java.util.function.Supplier;

import com.example.shipment.application.port.EventLogPort;
import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.DomainEvent;
import com.example.shipment.application.shared.eventsourcing.RecordedLogEvent;
import com.example.shipment.application.shared.eventsourcing.VersionedState;
import com.example.shipment.infra.event.mapper.DomainEventMapper;
import com.example.shipment.infra.persisence.SnapshotPersistence;

import lombok.extern.slf4j.Slf4j;

/**
 * 事件重播器 (Event Replayer)
 *
 * <p>
 * 以「快照 + 後續事件」或「從頭重播全部事件」重建聚合狀態。 兩種路徑對任意合法的快照位置都必須得到相同結果。
 * </p>
 *
 * <pre>
 * 1. 讀取串流目前的最後序號。
 * 2. 最後序號 (revision，即串流長度 - 1) 未超過快照門檻：從預設狀態、Revision 0 開始。
 * 3. 最後序號超過門檻：嘗試讀取快照，存在則從 position + 1 開始補齊，否則從頭重播。
 * 4. 逐筆解析事件型別並套用，position 同步為該事件的序號。
 * </pre>
 *
 * <p>
 * 每次呼叫都建立新的狀態實例，可安全地重複及並行呼叫。
 * </p>
 */
@Slf4j
public class EventReplayer<S extends AggregateState> {

	private final EventLogPort eventLog;
	private final SnapshotPersistence<S> snapshots;
	private final DomainEventMapper<S> mapper;
	private final Supplier<S> stateFactory;
	private final long snapshotThreshold;

	public EventReplayer(EventLogPort eventLog, SnapshotPersistence<S> snapshots, DomainEventMapper<S> mapper,
			Supplier<S> stateFactory, long snapshotThreshold) {
		this.eventLog = eventLog;
		this.snapshots = snapshots;
		this.mapper = mapper;
		this.stateFactory = stateFactory;
		this.snapshotThreshold = snapshotThreshold;
	}

	/**
	 * 重建聚合狀態
	 *
	 * @param aggregateId 聚合 ID (即串流名稱)
	 * @return 版本與狀態；串流不存在時為 (NO_STREAM, 預設狀態)
	 */
	public VersionedState<S> replay(String aggregateId) {
		long headRevision = eventLog.currentRevision(aggregateId);

		S state = stateFactory.get();
		long version = AggregateState.NO_STREAM;

		if (headRevision > snapshotThreshold) {
			Optional<S> snapshot = snapshots.findLatest(aggregateId);
			if (snapshot.isPresent() && isUsable(aggregateId, snapshot.get(), headRevision)) {
				state = snapshot.get();
				version = state.getPosition();
				log.info(">>> [Recovery] 發現快照！{} 從序號 {} 之後開始補齊事件", aggregateId, version);
			}
		}

		Optional<Iterable<RecordedLogEvent>> records = eventLog.readForward(aggregateId, version + 1);
		if (records.isEmpty()) {
			return new VersionedState<>(AggregateState.NO_STREAM, stateFactory.get());
		}

		int applied = 0;
		for (RecordedLogEvent record : records.get()) {
			DomainEvent<S> event = mapper.toDomainEvent(record);
			state = event.applyTo(state);
			state.setPosition(record.revision());
			version = record.revision();
			applied++;
		}
		log.debug(">>> [EventStore] {} 重播 {} 筆事件，目前版本 {}", aggregateId, applied, version);

		return new VersionedState<>(version, state);
	}

	/**
	 * 快照序號不可超過串流實際長度，否則代表快照與日誌不一致，改為從頭重播
	 */
	private boolean isUsable(String aggregateId, S snapshot, long headRevision) {
		long position = snapshot.getPosition();
		if (position < 0 || position > headRevision) {
			log.warn(">>> [Recovery] {} 的快照序號 {} 與串流最後序號 {} 不一致，改為從頭重播", aggregateId, position,
					headRevision);
			return false;
		}
		return true;
	}
}

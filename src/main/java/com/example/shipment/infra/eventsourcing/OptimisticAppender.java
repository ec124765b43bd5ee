package com.example.shipment.infra.eventsourcing;

import java.util.List;

import com.example.shipment.application.port.EventLogPort;
import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.AppendResult;
import com.example.shipment.application.shared.eventsourcing.DomainEvent;
import com.example.shipment.application.shared.eventsourcing.LogEventData;
import com.example.shipment.infra.event.codec.JsonPayloadCodec;
import com.example.shipment.infra.event.mapper.DomainEventMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * 樂觀鎖事件追加器 (Optimistic Appender)
 *
 * <p>
 * 將事件依呼叫端給定的順序轉為日誌紀錄，並以 expectedVersion 作為條件寫入。 寫入成功後把「追加後的狀態」交給
 * {@link SnapshotCompactor}；快照流程的任何失敗都不會改變追加結果。
 * </p>
 *
 * <ul>
 * <li>成功：回傳 EventStore 回報的最新序號</li>
 * <li>版本不符：回傳 {@link AppendResult#conflict()}，串流內容不變</li>
 * <li>儲存體無法存取：拋出 StorageUnavailableException</li>
 * </ul>
 */
@Slf4j
public class OptimisticAppender<S extends AggregateState> {

	private final EventLogPort eventLog;
	private final DomainEventMapper<S> mapper;
	private final SnapshotCompactor<S> compactor;
	private final JsonPayloadCodec codec;
	private final Class<S> stateType;

	public OptimisticAppender(EventLogPort eventLog, DomainEventMapper<S> mapper, SnapshotCompactor<S> compactor,
			JsonPayloadCodec codec, Class<S> stateType) {
		this.eventLog = eventLog;
		this.mapper = mapper;
		this.compactor = compactor;
		this.codec = codec;
		this.stateType = stateType;
	}

	/**
	 * 條件式追加事件
	 *
	 * @param aggregateId     聚合 ID
	 * @param events          依序寫入的事件
	 * @param expectedVersion 預期的串流最後序號，負值代表串流必須尚不存在
	 * @param baseState       expectedVersion 時的狀態，用來推導快照；為 null 或 position 不等於 expectedVersion 時略過快照
	 */
	public AppendResult append(String aggregateId, List<? extends DomainEvent<S>> events, long expectedVersion,
			S baseState) {
		long expected = expectedVersion < 0 ? AggregateState.NO_STREAM : expectedVersion;
		List<LogEventData> records = events.stream().map(mapper::toLogEventData).toList();

		AppendResult result = eventLog.appendConditional(aggregateId, expected, records);
		if (!result.isApplied()) {
			log.warn(">>> [Append] {} 版本衝突 (Expected: {})，呼叫端需重新讀取後重試", aggregateId, expected);
			return result;
		}

		log.debug(">>> [Append] {} 寫入 {} 筆事件，最新序號 {}", aggregateId, records.size(), result.newVersion());
		compactAfterAppend(aggregateId, events, expected, result.newVersion(), baseState);
		return result;
	}

	/**
	 * 以 baseState 的複本套用新事件，產生與 newVersion 對應的快照候選
	 *
	 * <p>
	 * baseState 的 position 必須等於 expectedVersion，否則折疊出的內容與 newVersion 不符，略過快照並回報失敗。
	 * </p>
	 */
	private void compactAfterAppend(String aggregateId, List<? extends DomainEvent<S>> events, long expectedVersion,
			long newVersion, S baseState) {
		if (baseState == null || !compactor.shouldCompact(newVersion)) {
			return;
		}
		long basePosition = baseState.getPosition() < 0 ? AggregateState.NO_STREAM : baseState.getPosition();
		if (basePosition != expectedVersion) {
			compactor.reportFailure(aggregateId, newVersion, new IllegalStateException(
					"快照基準狀態序號 " + basePosition + " 與預期版本 " + expectedVersion + " 不一致，略過快照"));
			return;
		}
		try {
			S candidate = codec.copy(baseState, stateType);
			for (DomainEvent<S> event : events) {
				candidate = event.applyTo(candidate);
			}
			candidate.setPosition(newVersion);
			compactor.maybeCompact(aggregateId, newVersion, candidate);
		} catch (RuntimeException e) {
			compactor.reportFailure(aggregateId, newVersion, e);
		}
	}
}

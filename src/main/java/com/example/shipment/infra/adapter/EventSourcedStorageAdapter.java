package com.example.shipment.infra.adapter;

import java.util.List;
import java.util.function.Supplier;

import com.example.shipment.application.port.AggregateStoragePort;
import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.AppendResult;
import com.example.shipment.application.shared.eventsourcing.DomainEvent;
import com.example.shipment.application.shared.eventsourcing.VersionedState;
import com.example.shipment.infra.eventsourcing.EventReplayer;
import com.example.shipment.infra.eventsourcing.OptimisticAppender;

import lombok.RequiredArgsConstructor;

/**
 * 聚合儲存轉接器 (Infrastructure Adapter)
 *
 * <p>
 * 實作 {@link AggregateStoragePort}，讀取委派給 {@link EventReplayer}，寫入委派給
 * {@link OptimisticAppender}。
 * </p>
 *
 * <ul>
 * <li>版本衝突回傳 false，呼叫端重新讀取後重試</li>
 * <li>儲存體無法存取與資料無法解讀一律以例外拋出，不會回傳 false</li>
 * </ul>
 */
@RequiredArgsConstructor
public class EventSourcedStorageAdapter<S extends AggregateState> implements AggregateStoragePort<S> {

	private final EventReplayer<S> replayer;
	private final OptimisticAppender<S> appender;
	private final Supplier<S> defaultState;

	@Override
	public VersionedState<S> readState(String aggregateId) {
		if (aggregateId == null) {
			return new VersionedState<>(AggregateState.NO_STREAM, defaultState.get());
		}
		return replayer.replay(aggregateId);
	}

	@Override
	public AppendResult appendUpdates(List<? extends DomainEvent<S>> updates, long expectedVersion,
			String aggregateId, S state) {
		if (aggregateId == null) {
			throw new IllegalArgumentException("aggregateId 不可為空");
		}
		if (updates == null || updates.isEmpty()) {
			throw new IllegalArgumentException("updates 不可為空");
		}
		return appender.append(aggregateId, updates, expectedVersion, state);
	}
}

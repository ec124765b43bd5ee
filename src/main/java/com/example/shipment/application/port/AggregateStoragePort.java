package com.example.shipment.application.port;

import java.util.List;

import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.AppendResult;
import com.example.shipment.application.shared.eventsourcing.DomainEvent;
import com.example.shipment.application.shared.eventsourcing.VersionedState;

/**
 * 聚合狀態存取埠 (Aggregate Storage Port)
 *
 * <p>
 * 提供給宿主 (每個聚合 ID 只有一個權威實例的呼叫端) 使用的讀寫介面。
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
public interface AggregateStoragePort<S extends AggregateState> {

	/**
	 * 從儲存體重建目前的版本與狀態
	 *
	 * <p>
	 * 回傳的狀態每次都是新建立的實例，呼叫端可自由修改。
	 * </p>
	 *
	 * @param aggregateId 聚合 ID，為 null 時直接回傳新狀態與 {@link AggregateState#NO_STREAM}
	 */
	VersionedState<S> readState(String aggregateId);

	/**
	 * 以樂觀鎖將事件寫入儲存體
	 *
	 * @param updates         依序套用的事件
	 * @param expectedVersion 呼叫端所認知的目前版本 (新聚合為 {@link AggregateState#NO_STREAM})
	 * @param aggregateId     聚合 ID
	 * @param state           {@code expectedVersion} 時的狀態 (即 readState 的結果)，僅用於產生快照，不會被修改
	 * @return true 代表事件已寫入；false 代表版本衝突，呼叫端應重新讀取後重試
	 */
	default boolean applyUpdates(List<? extends DomainEvent<S>> updates, long expectedVersion, String aggregateId,
			S state) {
		return appendUpdates(updates, expectedVersion, aggregateId, state).isApplied();
	}

	/**
	 * 與 {@link #applyUpdates} 相同，但成功時帶回事件日誌回報的最新版本
	 *
	 * @return 成功時為 {@link AppendResult#applied(long)}；版本衝突時為 {@link AppendResult#conflict()}
	 * @throws IllegalArgumentException aggregateId 為 null、updates 為空或含未登錄的事件型別
	 */
	AppendResult appendUpdates(List<? extends DomainEvent<S>> updates, long expectedVersion, String aggregateId,
			S state);
}

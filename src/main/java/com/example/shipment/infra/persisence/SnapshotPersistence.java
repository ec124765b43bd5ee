package com.example.shipment.infra.persisence;

import java.util.Optional;

import com.example.shipment.application.shared.eventsourcing.AggregateState;

/**
 * 聚合快照持久化工具 (Internal Infrastructure Interface)
 *
 * <p>
 * 這僅是基礎設施層內部的技術介面，快照以「狀態型別標籤 + 聚合 ID」為鍵，每個鍵只保留最新一份。 快照只是快取，事件日誌才是權威資料來源。
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
public interface SnapshotPersistence<S extends AggregateState> {

	/**
	 * @return 快照所屬的狀態型別標籤 (狀態類別的 simple name)
	 */
	String getTypeTag();

	/**
	 * 儲存 (覆蓋) 快照
	 *
	 * @param aggregateId 聚合 ID
	 * @param snapshot    已設定 position 的狀態
	 */
	void save(String aggregateId, S snapshot);

	/**
	 * 取得最新的快照
	 *
	 * @param aggregateId 聚合 ID
	 * @return 快照，尚未建立過快照時回傳 Optional.empty()
	 */
	Optional<S> findLatest(String aggregateId);
}

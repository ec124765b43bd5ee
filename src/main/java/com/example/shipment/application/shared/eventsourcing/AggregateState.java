package com.example.shipment.application.shared.eventsourcing;

/**
 * 可由事件重播重建的聚合狀態 (Memento)
 *
 * <p>
 * 狀態本身只記錄「最後一個已套用事件的序號」(position)，快照存檔時一併保存， 重播時從 {@code position + 1}
 * 開始補齊後續事件。
 * </p>
 *
 * <p>
 * 實作類別必須提供無參數建構子，新建立的狀態 position 應為 {@link #NO_STREAM}。
 * </p>
 */
public interface AggregateState {

	/**
	 * 「串流尚未存在」的版本哨兵值
	 */
	long NO_STREAM = -1L;

	/**
	 * @return 最後一個已套用事件的序號 (Revision)，尚未套用任何事件時為 {@link #NO_STREAM}
	 */
	long getPosition();

	void setPosition(long position);
}

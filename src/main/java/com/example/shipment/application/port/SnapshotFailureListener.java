package com.example.shipment.application.port;

/**
 * 快照寫入失敗的觀測點
 *
 * <p>
 * 快照只是重播加速用的快取，寫入失敗不影響事件追加的結果，但必須被觀測到而不是靜默吞掉。
 * </p>
 */
@FunctionalInterface
public interface SnapshotFailureListener {

	/**
	 * @param aggregateId 聚合 ID
	 * @param position    欲寫入快照的序號
	 * @param cause       失敗原因
	 */
	void onSnapshotFailure(String aggregateId, long position, Throwable cause);
}

package com.example.shipment.application.shared.eventsourcing;

/**
 * 重播結果：版本號與重建完成的狀態
 *
 * @param version 最後一個已套用事件的序號，新聚合為 {@link AggregateState#NO_STREAM}
 * @param state   每次讀取都重新建立的狀態實例
 */
public record VersionedState<S extends AggregateState>(long version, S state) {

	public boolean isNew() {
		return version == AggregateState.NO_STREAM;
	}
}

package com.example.shipment.application.domain.shipment.aggregate;

import java.time.Instant;

import com.example.shipment.application.domain.shipment.aggregate.vo.TransitStatus;
import com.example.shipment.application.shared.eventsourcing.AggregateState;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 貨件聚合狀態
 *
 * <p>
 * 只能透過事件重播推進，亦直接作為快照內容序列化。
 * </p>
 */
@Data
@NoArgsConstructor
public class ShipmentState implements AggregateState {

	private TransitStatus status = TransitStatus.AWAITING_PICKUP;

	private Instant pickedUpAt;

	private Instant deliveredAt;

	/**
	 * 最後一個已套用事件的序號
	 */
	private long position = NO_STREAM;
}

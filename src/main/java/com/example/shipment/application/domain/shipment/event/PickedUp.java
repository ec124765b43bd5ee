package com.example.shipment.application.domain.shipment.event;

import java.time.Instant;

import com.example.shipment.application.domain.shipment.aggregate.ShipmentState;
import com.example.shipment.application.domain.shipment.aggregate.vo.TransitStatus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 貨件已取件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PickedUp implements ShipmentEvent {

	private Instant occurredAt;

	@Override
	public ShipmentState applyTo(ShipmentState state) {
		state.setStatus(TransitStatus.IN_TRANSIT);
		state.setPickedUpAt(occurredAt);
		return state;
	}
}

package com.example.shipment.application.shared.projection;

import java.time.Instant;

import com.example.shipment.application.domain.shipment.aggregate.ShipmentState;
import com.example.shipment.application.domain.shipment.aggregate.vo.TransitStatus;

/**
 * Query Model
 */
public record ShipmentQueriedProjection(String shipmentId, TransitStatus status, long version, Instant pickedUpAt,
		Instant deliveredAt) {

	public static ShipmentQueriedProjection of(String shipmentId, long version, ShipmentState state) {
		return new ShipmentQueriedProjection(shipmentId, state.getStatus(), version, state.getPickedUpAt(),
				state.getDeliveredAt());
	}
}

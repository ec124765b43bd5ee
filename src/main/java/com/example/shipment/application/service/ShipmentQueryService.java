package com.example.shipment.application.service;

import org.springframework.stereotype.Service;

import com.example.shipment.application.domain.shipment.aggregate.ShipmentState;
import com.example.shipment.application.port.AggregateStoragePort;
import com.example.shipment.application.shared.eventsourcing.VersionedState;
import com.example.shipment.application.shared.projection.ShipmentQueriedProjection;

import lombok.AllArgsConstructor;

@Service
@AllArgsConstructor
public class ShipmentQueryService {

	private AggregateStoragePort<ShipmentState> shipmentStorage;

	/**
	 * 重播事件取得貨件目前狀態，從未寫入過的貨件回傳 AWAITING_PICKUP 與版本 -1
	 *
	 * @param shipmentId 貨件 ID
	 */
	public ShipmentQueriedProjection getStatus(String shipmentId) {
		VersionedState<ShipmentState> current = shipmentStorage.readState(shipmentId);
		return ShipmentQueriedProjection.of(shipmentId, current.version(), current.state());
	}
}

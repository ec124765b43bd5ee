package com.example.shipment.application.domain.shipment.event;

import com.example.shipment.application.domain.shipment.aggregate.ShipmentState;
import com.example.shipment.application.shared.eventsourcing.EventTypeRegistry;

/**
 * 貨件事件型別登錄表
 *
 * <p>
 * 新增事件型別時必須在此登錄，否則寫入會被拒絕、重播會視為無法解讀的資料。
 * </p>
 */
public final class ShipmentEventTypes {

	private static final EventTypeRegistry<ShipmentState> REGISTRY = EventTypeRegistry.<ShipmentState>builder()
			.register(PickedUp.class)
			.register(Delivered.class)
			.build();

	private ShipmentEventTypes() {
	}

	public static EventTypeRegistry<ShipmentState> registry() {
		return REGISTRY;
	}
}

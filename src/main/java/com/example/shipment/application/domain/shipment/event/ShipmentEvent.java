package com.example.shipment.application.domain.shipment.event;

import com.example.shipment.application.domain.shipment.aggregate.ShipmentState;
import com.example.shipment.application.shared.eventsourcing.DomainEvent;

/**
 * 貨件領域事件
 */
public interface ShipmentEvent extends DomainEvent<ShipmentState> {
}

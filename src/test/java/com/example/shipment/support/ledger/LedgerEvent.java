package com.example.shipment.support.ledger;

import com.example.shipment.application.shared.eventsourcing.DomainEvent;
import com.example.shipment.application.shared.eventsourcing.EventTypeRegistry;

public interface LedgerEvent extends DomainEvent<LedgerState> {

	static EventTypeRegistry<LedgerState> registry() {
		return EventTypeRegistry.<LedgerState>builder().register(Credited.class).register(Multiplied.class).build();
	}
}

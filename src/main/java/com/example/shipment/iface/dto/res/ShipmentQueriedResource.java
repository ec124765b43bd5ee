package com.example.shipment.iface.dto.res;

import com.example.shipment.application.shared.projection.ShipmentQueriedProjection;

public record ShipmentQueriedResource(String code, String message, ShipmentQueriedProjection data) {

}

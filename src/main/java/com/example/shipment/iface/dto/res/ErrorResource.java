package com.example.shipment.iface.dto.res;

public record ErrorResource(String code, String message) {

}

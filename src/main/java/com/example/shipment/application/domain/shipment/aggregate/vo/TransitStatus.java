package com.example.shipment.application.domain.shipment.aggregate.vo;

/**
 * 貨件運送狀態，線性推進：AWAITING_PICKUP → IN_TRANSIT → DELIVERED
 */
public enum TransitStatus {

	AWAITING_PICKUP, // 等待取件

	IN_TRANSIT, // 運送中

	DELIVERED // 已送達 (終止狀態)
}

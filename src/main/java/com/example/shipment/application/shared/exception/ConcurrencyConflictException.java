package com.example.shipment.application.shared.exception;

/**
 * 業務指令在多次重試後仍無法寫入 (版本持續衝突)
 */
public class ConcurrencyConflictException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ConcurrencyConflictException(String message) {
		super(message);
	}
}

package com.example.shipment.application.shared.exception;

/**
 * 指令違反貨件狀態機的業務規則 (例如尚未取件即送達)
 */
public class BusinessRuleViolationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public BusinessRuleViolationException(String message) {
		super(message);
	}
}

package com.example.shipment.application.shared.exception;

/**
 * 事件日誌或快照儲存體無法存取 (可重試)
 */
public class StorageUnavailableException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public StorageUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

	public StorageUnavailableException(String message) {
		super(message);
	}
}

package com.example.shipment.application.shared.exception;

/**
 * 事件或快照資料無法解讀 (致命錯誤)
 *
 * <p>
 * 包含未登錄的事件型別與損毀的 JSON 內容。發生時聚合無法被安全重建，不可跳過或猜測部分狀態。
 * </p>
 */
public class EventDecodeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public EventDecodeException(String message, Throwable cause) {
		super(message, cause);
	}

	public EventDecodeException(String message) {
		super(message);
	}
}

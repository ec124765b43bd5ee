package com.example.shipment.iface.rest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.shipment.application.shared.exception.BusinessRuleViolationException;
import com.example.shipment.application.shared.exception.ConcurrencyConflictException;
import com.example.shipment.application.shared.exception.EventDecodeException;
import com.example.shipment.application.shared.exception.StorageUnavailableException;
import com.example.shipment.iface.dto.res.ErrorResource;

import lombok.extern.slf4j.Slf4j;

/**
 * 將應用層例外轉換為 HTTP 回應
 *
 * <ul>
 * <li>業務規則不允許 / 版本持續衝突：409</li>
 * <li>儲存體暫時無法存取：503，呼叫端可重試</li>
 * <li>事件或快照無法解讀、其他未預期錯誤：500</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class ShipmentExceptionHandler {

	@ExceptionHandler(BusinessRuleViolationException.class)
	public ResponseEntity<ErrorResource> handleRuleViolation(BusinessRuleViolationException e) {
		return build(HttpStatus.CONFLICT, e.getMessage());
	}

	@ExceptionHandler(ConcurrencyConflictException.class)
	public ResponseEntity<ErrorResource> handleConflict(ConcurrencyConflictException e) {
		return build(HttpStatus.CONFLICT, e.getMessage());
	}

	@ExceptionHandler(StorageUnavailableException.class)
	public ResponseEntity<ErrorResource> handleUnavailable(StorageUnavailableException e) {
		log.warn(">>> [API] 儲存體無法存取: {}", e.getMessage());
		return build(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
	}

	@ExceptionHandler(EventDecodeException.class)
	public ResponseEntity<ErrorResource> handleDecode(EventDecodeException e) {
		log.error(">>> [API] 事件資料無法解讀，聚合無法重建", e);
		return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
	}

	@ExceptionHandler(RuntimeException.class)
	public ResponseEntity<ErrorResource> handleUnexpected(RuntimeException e) {
		log.error(">>> [API] 未預期的錯誤", e);
		return build(HttpStatus.INTERNAL_SERVER_ERROR, "系統錯誤");
	}

	private ResponseEntity<ErrorResource> build(HttpStatus status, String message) {
		return ResponseEntity.status(status).body(new ErrorResource(String.valueOf(status.value()), message));
	}
}

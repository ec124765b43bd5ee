package com.example.shipment.infra.eventsourcing;

import java.util.concurrent.atomic.AtomicLong;

import com.example.shipment.application.port.SnapshotFailureListener;

import lombok.extern.slf4j.Slf4j;

/**
 * 預設的快照失敗觀測點：記錄警告並累計失敗次數
 */
@Slf4j
public class LoggingSnapshotFailureListener implements SnapshotFailureListener {

	private final AtomicLong failureCount = new AtomicLong();

	@Override
	public void onSnapshotFailure(String aggregateId, long position, Throwable cause) {
		long total = failureCount.incrementAndGet();
		log.warn(">>> [Snapshot] 快照失敗 (Aggregate: {}, Position: {})，累計 {} 次，下次讀取將以較長的重播補齊", aggregateId,
				position, total);
	}

	public long getFailureCount() {
		return failureCount.get();
	}
}

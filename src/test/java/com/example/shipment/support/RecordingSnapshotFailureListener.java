package com.example.shipment.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.example.shipment.application.port.SnapshotFailureListener;

public class RecordingSnapshotFailureListener implements SnapshotFailureListener {

	public record Failure(String aggregateId, long position, Throwable cause) {
	}

	private final List<Failure> failures = Collections.synchronizedList(new ArrayList<>());

	@Override
	public void onSnapshotFailure(String aggregateId, long position, Throwable cause) {
		failures.add(new Failure(aggregateId, position, cause));
	}

	public List<Failure> getFailures() {
		return List.copyOf(failures);
	}
}

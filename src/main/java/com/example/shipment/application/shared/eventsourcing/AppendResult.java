package com.example.shipment.application.shared.eventsourcing;

/**
 * 條件式追加 (Conditional Append) 的結果
 *
 * <p>
 * 版本衝突屬於正常的回傳值而非例外，呼叫端應重新讀取狀態後重試整個業務操作。
 * </p>
 *
 * @param status     追加結果
 * @param newVersion 追加成功後串流的最新序號 (由 EventStore 回報)；衝突時為 {@link AggregateState#NO_STREAM}
 */
public record AppendResult(Status status, long newVersion) {

	public enum Status {
		APPLIED, CONFLICT
	}

	public static AppendResult applied(long newVersion) {
		return new AppendResult(Status.APPLIED, newVersion);
	}

	public static AppendResult conflict() {
		return new AppendResult(Status.CONFLICT, AggregateState.NO_STREAM);
	}

	public boolean isApplied() {
		return status == Status.APPLIED;
	}
}

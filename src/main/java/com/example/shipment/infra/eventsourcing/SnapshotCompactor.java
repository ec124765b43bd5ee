package com.example.shipment.infra.eventsourcing;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import com.example.shipment.application.port.SnapshotFailureListener;
import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.infra.persisence.SnapshotPersistence;

import lombok.extern.slf4j.Slf4j;

/**
 * 快照壓縮器 (Snapshot Compactor)
 *
 * <p>
 * 每次成功追加事件後判斷是否需要存快照：新的最後序號 (revision，即串流長度 - 1) 超過門檻即寫入 (覆蓋) 快照。 快照寫入在獨立的 {@link Executor}
 * 上執行，失敗只會記錄並通知 {@link SnapshotFailureListener}，不影響追加本身的結果。
 * </p>
 */
@Slf4j
public class SnapshotCompactor<S extends AggregateState> {

	private final SnapshotPersistence<S> snapshots;
	private final long snapshotThreshold;
	private final Executor executor;
	private final SnapshotFailureListener failureListener;

	public SnapshotCompactor(SnapshotPersistence<S> snapshots, long snapshotThreshold, Executor executor,
			SnapshotFailureListener failureListener) {
		this.snapshots = snapshots;
		this.snapshotThreshold = snapshotThreshold;
		this.executor = executor;
		this.failureListener = failureListener;
	}

	/**
	 * @param newVersion 追加後的最後序號 (revision)，不是串流長度
	 * @return revision 是否超過快照門檻
	 */
	public boolean shouldCompact(long newVersion) {
		return newVersion > snapshotThreshold;
	}

	/**
	 * 視門檻寫入快照
	 *
	 * @param aggregateId 聚合 ID
	 * @param newVersion  追加後的串流序號
	 * @param state       position 已等於 newVersion 的狀態
	 * @return 快照寫入完成 (無論成功或失敗) 時完成的 Future，永遠不會以例外結束
	 */
	public CompletableFuture<Void> maybeCompact(String aggregateId, long newVersion, S state) {
		if (!shouldCompact(newVersion)) {
			return CompletableFuture.completedFuture(null);
		}
		try {
			return CompletableFuture.runAsync(() -> snapshots.save(aggregateId, state), executor)
					.handle((ignored, ex) -> {
						if (ex != null) {
							reportFailure(aggregateId, newVersion, unwrap(ex));
						} else {
							log.info(">>> [Snapshot] {} 快照完成，最新序號: {}", aggregateId, newVersion);
						}
						return null;
					});
		} catch (RuntimeException e) {
			// Executor 拒絕任務
			reportFailure(aggregateId, newVersion, e);
			return CompletableFuture.completedFuture(null);
		}
	}

	/**
	 * 記錄快照失敗並通知觀測點
	 */
	public void reportFailure(String aggregateId, long position, Throwable cause) {
		log.error(">>> [Snapshot] {} 快照寫入失敗 (Position: {}): {}", aggregateId, position, cause.getMessage(), cause);
		try {
			failureListener.onSnapshotFailure(aggregateId, position, cause);
		} catch (RuntimeException e) {
			log.error(">>> [Snapshot] SnapshotFailureListener 執行失敗", e);
		}
	}

	private static Throwable unwrap(Throwable ex) {
		return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
	}
}

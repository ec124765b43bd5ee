package com.example.shipment.infra.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.shipment.application.domain.shipment.aggregate.ShipmentState;
import com.example.shipment.application.domain.shipment.aggregate.vo.TransitStatus;
import com.example.shipment.application.domain.shipment.event.Delivered;
import com.example.shipment.application.domain.shipment.event.PickedUp;
import com.example.shipment.application.domain.shipment.event.ShipmentEvent;
import com.example.shipment.application.domain.shipment.event.ShipmentEventTypes;
import com.example.shipment.application.port.AggregateStoragePort;
import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.AppendResult;
import com.example.shipment.application.shared.eventsourcing.RecordedLogEvent;
import com.example.shipment.application.shared.eventsourcing.VersionedState;
import com.example.shipment.application.shared.exception.StorageUnavailableException;
import com.example.shipment.infra.eventsourcing.EventSourcingContext;
import com.example.shipment.support.InMemoryBlobStore;
import com.example.shipment.support.InMemoryEventLog;
import com.example.shipment.support.RecordingSnapshotFailureListener;
import com.example.shipment.support.TestJson;
import com.example.shipment.support.ledger.Credited;
import com.example.shipment.support.ledger.LedgerEvent;
import com.example.shipment.support.ledger.LedgerState;
import com.example.shipment.support.ledger.Multiplied;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>聚合儲存轉接器測試</h1>
 *
 * <pre>
 * <b>Feature:</b> ReadState / ApplyUpdates 的樂觀鎖語義與快照流程
 * <b>Given</b> 由 EventSourcingContext 組裝、背後為記憶體事件日誌與 Blob 儲存體的轉接器
 * <b>Then</b>  衝突回傳 false 且串流不變、成功時版本精確推進、快照失敗不影響寫入結果
 * </pre>
 */
@Slf4j
class EventSourcedStorageAdapterTest {

	private static final Instant T1 = Instant.parse("2024-05-01T08:00:00Z");
	private static final Instant T2 = Instant.parse("2024-05-02T17:30:00Z");

	private InMemoryEventLog eventLog;
	private InMemoryBlobStore blobStore;
	private RecordingSnapshotFailureListener failureListener;
	private EventSourcingContext context;

	@BeforeEach
	void setUp() {
		eventLog = new InMemoryEventLog();
		blobStore = new InMemoryBlobStore();
		failureListener = new RecordingSnapshotFailureListener();
		context = context(1000);
	}

	@AfterEach
	void tearDown() {
		context.close();
	}

	@Test
	@DisplayName("End-to-End：S1 取件、送達、重播，過期版本的第二次送達回傳 false")
	void shipmentEndToEnd() {
		AggregateStoragePort<ShipmentState> storage = shipments();

		// --- Step 1: 新貨件以 NO_STREAM 寫入取件事件 ---
		boolean pickedUp = storage.applyUpdates(List.of(new PickedUp(T1)), -1, "S1", new ShipmentState());
		assertThat(pickedUp).isTrue();
		assertThat(eventLog.stream("S1")).hasSize(1);

		// --- Step 2: 以版本 0 寫入送達事件 ---
		VersionedState<ShipmentState> afterPickup = storage.readState("S1");
		assertThat(afterPickup.version()).isZero();
		boolean delivered = storage.applyUpdates(List.of(new Delivered(T2)), 0, "S1", afterPickup.state());
		assertThat(delivered).isTrue();
		assertThat(eventLog.stream("S1")).hasSize(2);

		// --- Step 3: 重播 ---
		VersionedState<ShipmentState> current = storage.readState("S1");
		assertThat(current.version()).isEqualTo(1);
		assertThat(current.state().getStatus()).isEqualTo(TransitStatus.DELIVERED);
		assertThat(current.state().getPickedUpAt()).isEqualTo(T1);
		assertThat(current.state().getDeliveredAt()).isEqualTo(T2);

		// --- Step 4: 仍以版本 0 寫入者必須得到 false ---
		boolean stale = storage.applyUpdates(List.of(new Delivered(T2)), 0, "S1", afterPickup.state());
		assertThat(stale).isFalse();
		assertThat(eventLog.stream("S1")).hasSize(2);
	}

	@Test
	@DisplayName("Round-trip：新聚合一次寫入 N 筆事件後重播，版本為 N-1 且依序套用")
	void roundTripOfNewAggregate() {
		AggregateStoragePort<LedgerState> storage = ledgers();
		List<LedgerEvent> events = List.of(new Credited(1), new Multiplied(10), new Credited(4), new Multiplied(2));

		assertThat(storage.applyUpdates(events, AggregateState.NO_STREAM, "L-1", new LedgerState())).isTrue();
		VersionedState<LedgerState> result = storage.readState("L-1");

		assertThat(result.version()).isEqualTo(events.size() - 1);
		assertThat(result.state().getBalance()).isEqualTo(28);
		assertThat(result.state().getEntries()).containsExactly("+1", "x10", "+4", "x2");
	}

	@Test
	@DisplayName("Conflict isolation：過期版本寫入回傳 false，串流長度與內容保持不變")
	void staleExpectedVersionLeavesStreamUnchanged() {
		AggregateStoragePort<LedgerState> storage = ledgers();
		storage.applyUpdates(List.of(new Credited(1), new Credited(2)), -1, "L-1", new LedgerState());
		List<RecordedLogEvent> before = eventLog.stream("L-1");

		boolean applied = storage.applyUpdates(List.of(new Credited(99)), 0, "L-1", new LedgerState());

		assertThat(applied).isFalse();
		assertThat(eventLog.stream("L-1")).isEqualTo(before);
		assertThat(storage.readState("L-1").version()).isEqualTo(1);
	}

	@Test
	@DisplayName("以 NO_STREAM 寫入已存在的串流視為衝突")
	void noStreamExpectationConflictsWithExistingStream() {
		AggregateStoragePort<ShipmentState> storage = shipments();
		storage.applyUpdates(List.of(new PickedUp(T1)), -1, "S2", new ShipmentState());

		assertThat(storage.applyUpdates(List.of(new PickedUp(T2)), -1, "S2", new ShipmentState())).isFalse();
		assertThat(eventLog.stream("S2")).hasSize(1);
	}

	@Test
	@DisplayName("預期版本超前實際版本也視為衝突")
	void expectedVersionAheadOfStreamConflicts() {
		AggregateStoragePort<ShipmentState> storage = shipments();
		storage.applyUpdates(List.of(new PickedUp(T1)), -1, "S3", new ShipmentState());

		assertThat(storage.applyUpdates(List.of(new Delivered(T2)), 5, "S3", new ShipmentState())).isFalse();
	}

	@Test
	@DisplayName("New aggregate：從未寫入的 ID 回傳 (-1, 預設狀態)")
	void readOfNeverWrittenIdReturnsDefault() {
		VersionedState<ShipmentState> result = shipments().readState("never-written-id");

		assertThat(result.version()).isEqualTo(-1);
		assertThat(result.state().getStatus()).isEqualTo(TransitStatus.AWAITING_PICKUP);
	}

	@Test
	@DisplayName("未設定 ID 時直接回傳預設狀態，不存取事件日誌")
	void readWithoutIdDoesNotTouchLog() {
		eventLog.setUnavailable(true);

		VersionedState<ShipmentState> result = shipments().readState(null);

		assertThat(result.version()).isEqualTo(AggregateState.NO_STREAM);
		assertThat(result.state()).isEqualTo(new ShipmentState());
		assertThat(eventLog.getReadForwardStarts()).isEmpty();
	}

	@Test
	@DisplayName("ID 為空、事件為空或事件型別未登錄時拒絕寫入")
	void invalidUpdatesAreRejectedBeforeTouchingLog() {
		AggregateStoragePort<ShipmentState> storage = shipments();
		ShipmentEvent unregistered = state -> state;

		assertThatThrownBy(() -> storage.applyUpdates(List.of(new PickedUp(T1)), -1, null, new ShipmentState()))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> storage.applyUpdates(List.of(), -1, "S4", new ShipmentState()))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> storage.applyUpdates(List.of(unregistered), -1, "S4", new ShipmentState()))
				.isInstanceOf(IllegalArgumentException.class).hasMessageContaining("未登錄");
		assertThat(eventLog.getAppendCalls()).isZero();
	}

	@Test
	@DisplayName("儲存體無法存取時拋出例外而不是回傳 false")
	void unavailableLogIsSurfacedAsError() {
		eventLog.setUnavailable(true);

		assertThatThrownBy(() -> shipments().applyUpdates(List.of(new PickedUp(T1)), -1, "S5", new ShipmentState()))
				.isInstanceOf(StorageUnavailableException.class);
	}

	@Test
	@DisplayName("超過門檻後寫入快照，快照內容與位置對應追加後的狀態，且不修改呼叫端狀態")
	void snapshotIsStashedAfterThreshold() {
		context = context(2);
		AggregateStoragePort<LedgerState> storage = ledgers();

		for (int i = 1; i <= 4; i++) {
			VersionedState<LedgerState> current = storage.readState("L-2");
			LedgerState callerState = current.state();
			long balanceBefore = callerState.getBalance();

			assertThat(storage.applyUpdates(List.of(new Credited(i)), current.version(), "L-2", callerState)).isTrue();
			assertThat(callerState.getBalance()).isEqualTo(balanceBefore);
		}

		String key = LedgerState.class.getSimpleName() + ".L-2";
		assertThat(blobStore.getPutCalls()).isEqualTo(1);
		LedgerState snapshot = TestJson.codec().deserialize(blobStore.peek("snapshots", key).orElseThrow(),
				LedgerState.class);
		assertThat(snapshot.getPosition()).isEqualTo(3);
		assertThat(snapshot.getBalance()).isEqualTo(10);

		eventLog.resetCounters();
		VersionedState<LedgerState> replayed = storage.readState("L-2");
		assertThat(eventLog.getReadForwardStarts()).containsExactly(4L);
		assertThat(eventLog.getRecordsServed()).isZero();
		assertThat(replayed.state()).isEqualTo(snapshot);
	}

	@Test
	@DisplayName("快照寫入失敗時追加仍回傳 true，失敗被觀測點記錄")
	void snapshotFailureDoesNotFailAppend() {
		context = context(0);
		blobStore.setFailOnPut(true);
		AggregateStoragePort<ShipmentState> storage = shipments();
		storage.applyUpdates(List.of(new PickedUp(T1)), -1, "S6", new ShipmentState());

		boolean applied = storage.applyUpdates(List.of(new Delivered(T2)), 0, "S6", storage.readState("S6").state());

		assertThat(applied).isTrue();
		assertThat(eventLog.stream("S6")).hasSize(2);
		assertThat(failureListener.getFailures()).hasSize(1);
		assertThat(failureListener.getFailures().get(0).aggregateId()).isEqualTo("S6");
		assertThat(failureListener.getFailures().get(0).position()).isEqualTo(1);
		assertThat(failureListener.getFailures().get(0).cause()).isInstanceOf(StorageUnavailableException.class);
	}

	@Test
	@DisplayName("基準狀態與預期版本不一致時照常寫入，但不產生快照，讀取結果與從頭重播相同")
	void mismatchedBaseStateNeverBecomesSnapshot() {
		context = context(0);
		AggregateStoragePort<LedgerState> storage = ledgers();
		storage.applyUpdates(List.of(new Credited(5)), -1, "L-3", new LedgerState());

		// 預期版本正確，但傳入的是預設狀態而不是版本 0 的狀態
		boolean applied = storage.applyUpdates(List.of(new Credited(3)), 0, "L-3", new LedgerState());

		assertThat(applied).isTrue();
		assertThat(eventLog.stream("L-3")).hasSize(2);
		assertThat(blobStore.getPutCalls()).isZero();
		assertThat(failureListener.getFailures()).singleElement().satisfies(f -> {
			assertThat(f.aggregateId()).isEqualTo("L-3");
			assertThat(f.position()).isEqualTo(1);
		});

		VersionedState<LedgerState> current = storage.readState("L-3");
		assertThat(current.version()).isEqualTo(1);
		assertThat(current.state().getBalance()).isEqualTo(8);
		assertThat(current.state().getEntries()).containsExactly("+5", "+3");
	}

	@Test
	@DisplayName("appendUpdates 回傳事件日誌回報的最新版本")
	void appendUpdatesCarriesLoggedRevision() {
		AggregateStoragePort<LedgerState> storage = ledgers();

		AppendResult first = storage.appendUpdates(List.of(new Credited(1), new Credited(2), new Credited(3)), -1,
				"L-4", new LedgerState());
		AppendResult stale = storage.appendUpdates(List.of(new Credited(4)), 0, "L-4", new LedgerState());

		assertThat(first).isEqualTo(AppendResult.applied(2));
		assertThat(stale.isApplied()).isFalse();
	}

	@Test
	@DisplayName("相同預期版本的並行寫入只有一個成功")
	void onlyOneConcurrentWriterWins() throws Exception {
		AggregateStoragePort<ShipmentState> storage = shipments();
		storage.applyUpdates(List.of(new PickedUp(T1)), -1, "S7", new ShipmentState());

		int writers = 8;
		ExecutorService pool = Executors.newFixedThreadPool(writers);
		CountDownLatch start = new CountDownLatch(1);
		List<Future<Boolean>> results = new ArrayList<>();
		try {
			for (int i = 0; i < writers; i++) {
				Callable<Boolean> task = () -> {
					start.await();
					return storage.applyUpdates(List.of(new Delivered(T2)), 0, "S7", new ShipmentState());
				};
				results.add(pool.submit(task));
			}
			start.countDown();

			int wins = 0;
			for (Future<Boolean> result : results) {
				if (result.get(10, TimeUnit.SECONDS)) {
					wins++;
				}
			}
			log.info(">>> [Then] 並行寫入成功筆數: {}", wins);
			assertThat(wins).isEqualTo(1);
			assertThat(eventLog.stream("S7")).hasSize(2);
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	@DisplayName("關閉 Context 時釋放事件日誌")
	void closingContextClosesEventLog() {
		context.close();

		assertThat(eventLog.isClosed()).isTrue();
	}

	private EventSourcingContext context(long snapshotThreshold) {
		return EventSourcingContext.builder()
				.eventLog(eventLog)
				.blobStore(blobStore)
				.codec(TestJson.codec())
				.snapshotThreshold(snapshotThreshold)
				.failureListener(failureListener)
				.build();
	}

	private AggregateStoragePort<ShipmentState> shipments() {
		return context.storageFor(ShipmentState.class, ShipmentState::new, ShipmentEventTypes.registry());
	}

	private AggregateStoragePort<LedgerState> ledgers() {
		return context.storageFor(LedgerState.class, LedgerState::new, LedgerEvent.registry());
	}
}

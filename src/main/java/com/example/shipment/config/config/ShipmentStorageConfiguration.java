package com.example.shipment.config.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import com.eventstore.dbclient.EventStoreDBClient;
import com.example.shipment.application.domain.shipment.aggregate.ShipmentState;
import com.example.shipment.application.domain.shipment.event.ShipmentEventTypes;
import com.example.shipment.application.port.AggregateStoragePort;
import com.example.shipment.application.port.SnapshotFailureListener;
import com.example.shipment.infra.adapter.EventStoreDbLogAdapter;
import com.example.shipment.infra.adapter.JdbcBlobStoreAdapter;
import com.example.shipment.infra.event.codec.JsonPayloadCodec;
import com.example.shipment.infra.eventsourcing.EventSourcingContext;
import com.example.shipment.infra.eventsourcing.LoggingSnapshotFailureListener;

/**
 * <h1>Event Sourcing 儲存配置類</h1>
 *
 * <p>
 * 明確建立 {@link EventSourcingContext}：事件日誌 (EventStoreDB)、快照儲存體 (JDBC Blob)、 快照門檻與快照執行緒。
 * Context 由 Spring 管理生命週期，關閉時釋放 EventStoreDB 連線。
 * </p>
 */
@Configuration
public class ShipmentStorageConfiguration {

	/**
	 * 串流序號超過此值後才開始讀寫快照
	 */
	@Value("${eventsourcing.snapshot.threshold:1000}")
	private long snapshotThreshold;

	@Value("${eventsourcing.snapshot.container:snapshots}")
	private String snapshotContainer;

	/**
	 * 正向讀取事件時每頁的筆數
	 */
	@Value("${eventsourcing.read.page-size:500}")
	private int readPageSize;

	/**
	 * 快照專用的單一背景執行緒，快照寫入不阻塞事件追加
	 */
	@Bean(destroyMethod = "shutdown")
	public ExecutorService snapshotCompactionExecutor() {
		return Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "snapshot-compactor");
			thread.setDaemon(true);
			return thread;
		});
	}

	@Bean
	public SnapshotFailureListener snapshotFailureListener() {
		return new LoggingSnapshotFailureListener();
	}

	@Bean(destroyMethod = "close")
	public EventSourcingContext eventSourcingContext(EventStoreDBClient client, JdbcTemplate jdbcTemplate,
			JsonPayloadCodec codec, ExecutorService snapshotCompactionExecutor,
			SnapshotFailureListener snapshotFailureListener) {
		return EventSourcingContext.builder()
				.eventLog(new EventStoreDbLogAdapter(client, readPageSize))
				.blobStore(new JdbcBlobStoreAdapter(jdbcTemplate))
				.codec(codec)
				.snapshotThreshold(snapshotThreshold)
				.snapshotContainer(snapshotContainer)
				.compactionExecutor(snapshotCompactionExecutor)
				.failureListener(snapshotFailureListener)
				.build();
	}

	@Bean
	public AggregateStoragePort<ShipmentState> shipmentStorage(EventSourcingContext context) {
		return context.storageFor(ShipmentState.class, ShipmentState::new, ShipmentEventTypes.registry());
	}
}

package com.example.shipment.infra.persisence.impl;

import java.util.Optional;

import com.example.shipment.application.port.BlobStorePort;
import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.infra.event.codec.JsonPayloadCodec;
import com.example.shipment.infra.persisence.SnapshotPersistence;

import lombok.extern.slf4j.Slf4j;

/**
 * 以 Blob 儲存體保存 JSON 快照
 *
 * <p>
 * 快照鍵為 {@code "{StateTypeTag}.{id}"}，位於固定的快照 container 之內。 損毀的快照會以
 * {@link com.example.shipment.application.shared.exception.EventDecodeException} 拋出，不猜測部分狀態。
 * </p>
 */
@Slf4j
public class BlobSnapshotPersistence<S extends AggregateState> implements SnapshotPersistence<S> {

	private final BlobStorePort blobStore;
	private final JsonPayloadCodec codec;
	private final String container;
	private final Class<S> stateType;

	public BlobSnapshotPersistence(BlobStorePort blobStore, JsonPayloadCodec codec, String container,
			Class<S> stateType) {
		this.blobStore = blobStore;
		this.codec = codec;
		this.container = container;
		this.stateType = stateType;
	}

	@Override
	public String getTypeTag() {
		return stateType.getSimpleName();
	}

	@Override
	public void save(String aggregateId, S snapshot) {
		blobStore.put(container, keyOf(aggregateId), codec.serialize(snapshot));
		log.debug("[Snapshot] 已存入 {}: Position={}", keyOf(aggregateId), snapshot.getPosition());
	}

	@Override
	public Optional<S> findLatest(String aggregateId) {
		return blobStore.get(container, keyOf(aggregateId)).map(content -> codec.deserialize(content, stateType));
	}

	/**
	 * 組合快照鍵
	 */
	public String keyOf(String aggregateId) {
		return getTypeTag() + "." + aggregateId;
	}
}

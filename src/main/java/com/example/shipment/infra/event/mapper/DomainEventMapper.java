package com.example.shipment.infra.event.mapper;

import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.DomainEvent;
import com.example.shipment.application.shared.eventsourcing.EventTypeRegistry;
import com.example.shipment.application.shared.eventsourcing.LogEventData;
import com.example.shipment.application.shared.eventsourcing.RecordedLogEvent;
import com.example.shipment.application.shared.exception.EventDecodeException;
import com.example.shipment.infra.event.codec.JsonPayloadCodec;

import lombok.RequiredArgsConstructor;

/**
 * Domain Event 與事件日誌紀錄之間的映射器 (Event Mapper)
 *
 * <p>
 * 設計原則：
 * <ul>
 * <li>專責序列化/反序列化，不包含業務邏輯</li>
 * <li>typeTag 為事件類別的完整名稱，透過 {@link EventTypeRegistry} 靜態登錄表解析</li>
 * <li>無法解析的事件一律拋出 {@link EventDecodeException}，重播不可跳過未知事件</li>
 * </ul>
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
@RequiredArgsConstructor
public class DomainEventMapper<S extends AggregateState> {

	private final JsonPayloadCodec codec;

	private final EventTypeRegistry<S> registry;

	/**
	 * 將 Domain Event 封裝為可寫入事件日誌的紀錄
	 *
	 * @throws IllegalArgumentException 事件型別未登錄時拋出
	 */
	public LogEventData toLogEventData(DomainEvent<S> event) {
		String typeTag = registry.typeTagOf(event);
		return new LogEventData(typeTag, codec.serialize(event));
	}

	/**
	 * 將事件日誌紀錄還原為 Domain Event
	 *
	 * @throws EventDecodeException typeTag 未登錄或內容損毀
	 */
	public DomainEvent<S> toDomainEvent(RecordedLogEvent record) {
		Class<? extends DomainEvent<S>> type = registry.resolve(record.typeTag())
				.orElseThrow(() -> new EventDecodeException(
						"未知的事件型別: " + record.typeTag() + " (Revision " + record.revision() + ")"));
		return codec.deserialize(record.payload(), type);
	}
}

package com.example.shipment.application.shared.eventsourcing;

/**
 * 領域事件：每個事件型別自行定義如何推進聚合狀態
 *
 * <p>
 * 重播時事件型別由 {@link EventTypeRegistry} 靜態登錄表解析，不透過反射或動態派發尋找轉移方法。
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
public interface DomainEvent<S extends AggregateState> {

	/**
	 * 將本事件套用至狀態並回傳套用後的狀態
	 *
	 * @param state 目前狀態
	 * @return 套用後的狀態 (可為同一個實例)
	 */
	S applyTo(S state);
}

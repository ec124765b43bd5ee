package com.example.shipment.application.shared.eventsourcing;

/**
 * 待寫入事件日誌的紀錄
 *
 * @param typeTag 事件類別的完整名稱
 * @param payload 事件內容的 JSON 編碼
 */
public record LogEventData(String typeTag, byte[] payload) {
}

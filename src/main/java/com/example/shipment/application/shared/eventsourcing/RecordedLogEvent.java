package com.example.shipment.application.shared.eventsourcing;

/**
 * 已寫入事件日誌的紀錄
 *
 * @param revision 此事件在串流中的序號 (從 0 開始)
 * @param typeTag  事件類別的完整名稱
 * @param payload  事件內容的 JSON 編碼
 */
public record RecordedLogEvent(long revision, String typeTag, byte[] payload) {
}

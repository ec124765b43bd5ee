package com.example.shipment.application.port;

import java.util.List;
import java.util.Optional;

import com.example.shipment.application.shared.eventsourcing.AggregateState;
import com.example.shipment.application.shared.eventsourcing.AppendResult;
import com.example.shipment.application.shared.eventsourcing.LogEventData;
import com.example.shipment.application.shared.eventsourcing.RecordedLogEvent;

/**
 * 事件日誌儲存埠 (Event Log Port)
 *
 * <p>
 * 屬於 Application 層的 Outbound Port，描述每個聚合一條、只能追加的事件串流。 所有方法皆為阻塞呼叫，沒有內建逾時；
 * 執行緒被中斷時，實作必須取消進行中的請求並拋出 {@link java.util.concurrent.CancellationException}。
 * </p>
 *
 * <p>
 * 傳輸層失敗一律以 {@link com.example.shipment.application.shared.exception.StorageUnavailableException}
 * 拋出。
 * </p>
 */
public interface EventLogPort extends AutoCloseable {

	/**
	 * 取得串流目前最後一個事件的序號
	 *
	 * @param streamId 串流名稱 (即聚合 ID)
	 * @return 最後一個事件的序號，串流不存在時回傳 {@link AggregateState#NO_STREAM}
	 */
	long currentRevision(String streamId);

	/**
	 * 從指定序號開始正向讀取事件
	 *
	 * <p>
	 * 回傳的 Iterable 為延遲分頁讀取、有限且可重新迭代：每次呼叫 {@code iterator()} 都會從 {@code fromRevision}
	 * 重新開始。
	 * </p>
	 *
	 * @param streamId     串流名稱
	 * @param fromRevision 起始序號 (包含)
	 * @return 事件序列，串流不存在時回傳 Optional.empty()
	 */
	Optional<Iterable<RecordedLogEvent>> readForward(String streamId, long fromRevision);

	/**
	 * 條件式追加 (Compare-and-Append)
	 *
	 * <pre>
	 * expectedRevision 為 NO_STREAM：僅在串流尚不存在時寫入。
	 * expectedRevision 為具體序號：僅在串流最後序號恰好相等時寫入。
	 * </pre>
	 *
	 * @return 成功時帶有 EventStore 回報的最新序號；版本不符時回傳衝突結果，串流內容保持不變
	 */
	AppendResult appendConditional(String streamId, long expectedRevision, List<LogEventData> events);

	/**
	 * 釋放底層連線
	 */
	@Override
	default void close() {
	}
}

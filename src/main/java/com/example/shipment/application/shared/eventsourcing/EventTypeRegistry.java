package com.example.shipment.application.shared.eventsourcing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 事件型別登錄表 (Event Type Registry)
 *
 * <p>
 * 以事件類別的完整名稱 (Fully-Qualified Name) 作為 EventStore 中的 typeTag， 重播時只接受已登錄的型別。
 * 未登錄的 typeTag 代表資料無法安全解讀，由呼叫端視為致命的解碼錯誤。
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
public final class EventTypeRegistry<S extends AggregateState> {

	private final Map<String, Class<? extends DomainEvent<S>>> types;

	private EventTypeRegistry(Map<String, Class<? extends DomainEvent<S>>> types) {
		this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
	}

	public static <S extends AggregateState> Builder<S> builder() {
		return new Builder<>();
	}

	/**
	 * 依 typeTag 解析事件類別
	 *
	 * @param typeTag EventStore 紀錄上的事件型別
	 * @return 對應的事件類別，未登錄時回傳 Optional.empty()
	 */
	public Optional<Class<? extends DomainEvent<S>>> resolve(String typeTag) {
		return Optional.ofNullable(types.get(typeTag));
	}

	/**
	 * 取得事件寫入 EventStore 時使用的 typeTag
	 *
	 * @throws IllegalArgumentException 事件型別未登錄時拋出，避免寫入之後無法重播的資料
	 */
	public String typeTagOf(DomainEvent<S> event) {
		String typeTag = event.getClass().getName();
		if (!types.containsKey(typeTag)) {
			throw new IllegalArgumentException("事件型別未登錄: " + typeTag);
		}
		return typeTag;
	}

	public Set<String> typeTags() {
		return types.keySet();
	}

	public static final class Builder<S extends AggregateState> {

		private final Map<String, Class<? extends DomainEvent<S>>> types = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder<S> register(Class<? extends DomainEvent<S>> type) {
			types.put(type.getName(), type);
			return this;
		}

		public EventTypeRegistry<S> build() {
			return new EventTypeRegistry<>(types);
		}
	}
}

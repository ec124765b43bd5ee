package com.example.shipment.application.service;

import java.time.Clock;
import java.util.List;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.shipment.application.domain.shipment.aggregate.ShipmentState;
import com.example.shipment.application.domain.shipment.aggregate.vo.TransitStatus;
import com.example.shipment.application.domain.shipment.event.Delivered;
import com.example.shipment.application.domain.shipment.event.PickedUp;
import com.example.shipment.application.domain.shipment.event.ShipmentEvent;
import com.example.shipment.application.port.AggregateStoragePort;
import com.example.shipment.application.shared.eventsourcing.AppendResult;
import com.example.shipment.application.shared.eventsourcing.VersionedState;
import com.example.shipment.application.shared.exception.BusinessRuleViolationException;
import com.example.shipment.application.shared.exception.ConcurrencyConflictException;
import com.example.shipment.application.shared.projection.ShipmentQueriedProjection;

import lombok.extern.slf4j.Slf4j;

/**
 * 貨件指令服務
 *
 * <p>
 * 每個指令的流程：重播取得目前狀態 → 檢查業務規則 → 產生一個事件 → 以讀到的版本作為預期版本寫入。 寫入回報版本衝突時，
 * 重新讀取並重跑整個指令，超過重試次數則拋出 {@link ConcurrencyConflictException}。
 * </p>
 */
@Slf4j
@Service
public class ShipmentCommandService {

	private final AggregateStoragePort<ShipmentState> shipmentStorage;
	private final Clock clock;
	private final int maxAttempts;

	public ShipmentCommandService(AggregateStoragePort<ShipmentState> shipmentStorage, Clock clock,
			@Value("${shipment.command.max-attempts:3}") int maxAttempts) {
		this.shipmentStorage = shipmentStorage;
		this.clock = clock;
		this.maxAttempts = Math.max(1, maxAttempts);
	}

	/**
	 * 取件
	 *
	 * @throws BusinessRuleViolationException 貨件已取件或已送達
	 */
	public ShipmentQueriedProjection pickup(String shipmentId) {
		return execute(shipmentId, state -> {
			if (state.getStatus() == TransitStatus.IN_TRANSIT) {
				throw new BusinessRuleViolationException("貨件 " + shipmentId + " 已被取件");
			}
			if (state.getStatus() == TransitStatus.DELIVERED) {
				throw new BusinessRuleViolationException("貨件 " + shipmentId + " 已送達");
			}
			return new PickedUp(clock.instant());
		});
	}

	/**
	 * 送達
	 *
	 * @throws BusinessRuleViolationException 貨件尚未取件或已送達
	 */
	public ShipmentQueriedProjection deliver(String shipmentId) {
		return execute(shipmentId, state -> {
			if (state.getStatus() == TransitStatus.AWAITING_PICKUP) {
				throw new BusinessRuleViolationException("貨件 " + shipmentId + " 尚未取件");
			}
			if (state.getStatus() == TransitStatus.DELIVERED) {
				throw new BusinessRuleViolationException("貨件 " + shipmentId + " 已送達");
			}
			return new Delivered(clock.instant());
		});
	}

	private ShipmentQueriedProjection execute(String shipmentId, Function<ShipmentState, ShipmentEvent> decide) {
		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			VersionedState<ShipmentState> current = shipmentStorage.readState(shipmentId);
			ShipmentEvent event = decide.apply(current.state());

			AppendResult result = shipmentStorage.appendUpdates(List.of(event), current.version(), shipmentId,
					current.state());
			if (result.isApplied()) {
				long newVersion = result.newVersion();
				ShipmentState updated = event.applyTo(current.state());
				updated.setPosition(newVersion);
				log.info(">>> [Command] 貨件 {} 套用 {}，目前狀態 {} (版本 {})", shipmentId,
						event.getClass().getSimpleName(), updated.getStatus(), newVersion);
				return ShipmentQueriedProjection.of(shipmentId, newVersion, updated);
			}
			log.warn(">>> [Command] 貨件 {} 版本衝突 (第 {}/{} 次)，重新讀取後重試", shipmentId, attempt, maxAttempts);
		}
		throw new ConcurrencyConflictException("貨件 " + shipmentId + " 在 " + maxAttempts + " 次嘗試後仍版本衝突");
	}
}

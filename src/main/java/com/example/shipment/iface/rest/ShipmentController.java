package com.example.shipment.iface.rest;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.shipment.application.service.ShipmentCommandService;
import com.example.shipment.application.service.ShipmentQueryService;
import com.example.shipment.iface.dto.res.ShipmentQueriedResource;

import lombok.AllArgsConstructor;

/**
 * 貨件指令與查詢控制器
 *
 * <p>
 * <ul>
 * <li><b>Command Side</b>: POST 取件 / 送達，同步寫入 EventStore 後回傳最新狀態。</li>
 * <li><b>Query Side</b>: GET 透過事件重播 (可搭配快照) 取得目前狀態。</li>
 * </ul>
 * </p>
 */
@RestController
@AllArgsConstructor
@RequestMapping("/shipments")
public class ShipmentController {

	private final ShipmentCommandService commandService;
	private final ShipmentQueryService queryService;

	@PostMapping("/{id}/pickup")
	public ResponseEntity<ShipmentQueriedResource> pickup(@PathVariable String id) {
		return ResponseEntity.ok(new ShipmentQueriedResource("200", "取件完成", commandService.pickup(id)));
	}

	@PostMapping("/{id}/deliver")
	public ResponseEntity<ShipmentQueriedResource> deliver(@PathVariable String id) {
		return ResponseEntity.ok(new ShipmentQueriedResource("200", "送達完成", commandService.deliver(id)));
	}

	@GetMapping("/{id}")
	public ResponseEntity<ShipmentQueriedResource> getStatus(@PathVariable String id) {
		return ResponseEntity.ok(new ShipmentQueriedResource("200", "查詢成功", queryService.getStatus(id)));
	}
}

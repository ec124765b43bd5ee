package com.example.shipment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShipmentEventStoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShipmentEventStoreApplication.class, args);
	}

}

package org.mides.routing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeliveryRoutingEngine {

	public static void main(String[] args) {
		SpringApplication.run(DeliveryRoutingEngine.class, args);
	}
}

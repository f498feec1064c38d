package com.market.pulse.enricher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketPulseApplication {

	public static void main(String[] args) {
		SpringApplication.run(MarketPulseApplication.class, args);
	}

}

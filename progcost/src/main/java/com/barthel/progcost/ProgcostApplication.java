package com.barthel.progcost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProgcostApplication {

	public static void main(String[] args) {
		SpringApplication.run(ProgcostApplication.class, args);
	}

}

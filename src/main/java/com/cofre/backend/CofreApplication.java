package com.cofre.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CofreApplication {

	public static void main(String[] args) {
		SpringApplication.run(CofreApplication.class, args);
	}

}

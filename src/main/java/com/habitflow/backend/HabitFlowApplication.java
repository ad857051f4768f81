package com.habitflow.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HabitFlowApplication {

	public static void main(String[] args) {
		SpringApplication.run(HabitFlowApplication.class, args);
	}

}

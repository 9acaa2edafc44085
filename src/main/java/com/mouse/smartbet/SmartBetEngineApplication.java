package com.mouse.smartbet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SmartBetEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(SmartBetEngineApplication.class, args);
	}

}

package com.edgegate.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EdgeGateApplication {
	public static void main(String[] args) {
		SpringApplication.run(EdgeGateApplication.class, args);
	}
}

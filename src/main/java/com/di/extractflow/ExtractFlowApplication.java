package com.di.extractflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExtractFlowApplication {

	public static void main(String[] args) {
		SpringApplication.run(ExtractFlowApplication.class, args);
	}
}

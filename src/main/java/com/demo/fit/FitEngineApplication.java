package com.demo.fit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FitEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(FitEngineApplication.class, args);
	}

}

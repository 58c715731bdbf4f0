package com.example.sidelight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SidelightApplication {

	public static void main(String[] args) {
		SpringApplication.run(SidelightApplication.class, args);
	}

}

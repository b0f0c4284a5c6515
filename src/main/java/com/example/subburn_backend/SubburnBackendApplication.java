package com.example.subburn_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SubburnBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(SubburnBackendApplication.class, args);
	}

}

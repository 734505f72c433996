package com.has;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HasBeApplication {

	public static void main(String[] args) {
		SpringApplication.run(HasBeApplication.class, args);
	}

}

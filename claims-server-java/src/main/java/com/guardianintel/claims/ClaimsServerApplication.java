package com.guardianintel.claims;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClaimsServerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClaimsServerApplication.class, args);
	}

}

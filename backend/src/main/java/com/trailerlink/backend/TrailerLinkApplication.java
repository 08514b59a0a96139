package com.trailerlink.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrailerLinkApplication {

	public static void main(String[] args) {
		// Submission and approval timestamps are compared across hosts, keep the JVM on UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(TrailerLinkApplication.class, args);
	}

}

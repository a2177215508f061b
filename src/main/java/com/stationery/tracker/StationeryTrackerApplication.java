package com.stationery.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StationeryTrackerApplication {

	public static void main(String[] args) {
		SpringApplication.run(StationeryTrackerApplication.class, args);
	}

}

package com.tripnav;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TripNavApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripNavApplication.class, args);
    }
}

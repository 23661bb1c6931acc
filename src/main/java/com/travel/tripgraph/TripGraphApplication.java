package com.travel.tripgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TripGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripGraphApplication.class, args);
    }
}

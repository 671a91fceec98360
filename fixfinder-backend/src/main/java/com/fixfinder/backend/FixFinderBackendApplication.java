package com.fixfinder.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class FixFinderBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(FixFinderBackendApplication.class, args);
    }
}

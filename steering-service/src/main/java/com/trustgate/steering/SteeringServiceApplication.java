package com.trustgate.steering;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SteeringServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SteeringServiceApplication.class, args);
    }
}

package com.propertychain.throttling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RequestThrottlingApplication {

    public static void main(String[] args) {
        SpringApplication.run(RequestThrottlingApplication.class, args);
    }
}

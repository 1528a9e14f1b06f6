package com.structbp.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StructuredBpApplication {

    public static void main(String[] args) {
        SpringApplication.run(StructuredBpApplication.class, args);
    }
}

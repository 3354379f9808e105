package com.phodal.tracegen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TraceGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceGenApplication.class, args);
    }
}

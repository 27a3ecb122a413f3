package com.evarsity.lifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LifecycleEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(LifecycleEngineApplication.class, args);
    }
}

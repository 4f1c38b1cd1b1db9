package com.botflow.botflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BotflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotflowBackendApplication.class, args);
    }
}

package com.threadbox.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.threadbox")
public class ThreadboxBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThreadboxBackendApplication.class, args);
    }
}

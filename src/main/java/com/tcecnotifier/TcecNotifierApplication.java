package com.tcecnotifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the TCEC game notifier.
 */
@SpringBootApplication
@EnableScheduling
public class TcecNotifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(TcecNotifierApplication.class, args);
    }
}

package com.campus.messaging;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RealtimeMessagingApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeMessagingApplication.class, args);
    }
}

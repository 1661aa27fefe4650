package com.example.roomhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoomHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoomHubApplication.class, args);
    }
}

package com.meetbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetBridgeApplication.class, args);
    }
}

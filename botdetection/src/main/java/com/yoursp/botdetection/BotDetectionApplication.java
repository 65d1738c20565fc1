package com.yoursp.botdetection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BotDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotDetectionApplication.class, args);
    }
}

package com.feedwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FeedwatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedwatchApplication.class, args);
    }
}

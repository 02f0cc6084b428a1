package com.crosswatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CrossWatchWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrossWatchWorkerApplication.class, args);
    }
}

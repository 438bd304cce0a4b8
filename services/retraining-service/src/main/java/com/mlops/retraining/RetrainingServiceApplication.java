package com.mlops.retraining;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RetrainingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(RetrainingServiceApplication.class, args);
    }
}

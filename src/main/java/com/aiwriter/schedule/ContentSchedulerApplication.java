package com.aiwriter.schedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentSchedulerApplication {
    public static void main(String[] args) {
        SpringApplication.run(ContentSchedulerApplication.class, args);
    }
}

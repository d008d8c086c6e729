package com.biocbot.content;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseContentSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(CourseContentSyncApplication.class, args);
    }
}

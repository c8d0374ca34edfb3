package com.example.taskboard.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.example.taskboard")
@EnableScheduling
public class TaskboardRealtimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskboardRealtimeApplication.class, args);
    }
}

package com.taskdrive.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for a TaskDrive worker process.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskDriveApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskDriveApplication.class, args);
    }
}

package com.aigreentick.services.groupcast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GroupcastApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroupcastApplication.class, args);
    }
}

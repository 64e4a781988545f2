package com.herzen.activity;

import com.herzen.activity.config.ActivityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ActivityProperties.class)
public class LearnerActivityApplication {
    public static void main(String[] args) {
        SpringApplication.run(LearnerActivityApplication.class, args);
    }
}

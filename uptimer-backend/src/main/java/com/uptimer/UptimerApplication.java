package com.uptimer;

import com.uptimer.config.UptimerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(UptimerProperties.class)
public class UptimerApplication {

    public static void main(String[] args) {
        SpringApplication.run(UptimerApplication.class, args);
    }
}

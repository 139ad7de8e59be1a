package com.streamfirst.olap.cooldown.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CooldownApplication {

    public static void main(String[] args) {
        SpringApplication.run(CooldownApplication.class, args);
    }
}

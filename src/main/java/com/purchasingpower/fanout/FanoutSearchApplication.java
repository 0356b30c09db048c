package com.purchasingpower.fanout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FanoutSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(FanoutSearchApplication.class, args);
    }
}

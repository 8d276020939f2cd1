package com.leverageloop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LeverageLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeverageLoopApplication.class, args);
    }
}

package com.commutematch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CommuteMatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(CommuteMatchApplication.class, args);
    }
}

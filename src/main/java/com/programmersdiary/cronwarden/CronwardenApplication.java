package com.programmersdiary.cronwarden;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CronwardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronwardenApplication.class, args);
    }
}

package com.jobbergate.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JobbergateApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobbergateApiApplication.class, args);
    }
}

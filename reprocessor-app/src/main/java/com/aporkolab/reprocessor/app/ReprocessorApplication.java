package com.aporkolab.reprocessor.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReprocessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReprocessorApplication.class, args);
    }
}

package com.jay.valuelens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ValueLensApplication {
    public static void main(String[] args) {
        SpringApplication.run(ValueLensApplication.class, args);
    }
}

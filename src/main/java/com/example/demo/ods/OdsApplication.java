package com.example.demo.ods;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OdsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OdsApplication.class, args);
    }
}

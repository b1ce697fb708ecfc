package com.example.xssfilter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XssFilterApplication {

    public static void main(String[] args) {
        SpringApplication.run(XssFilterApplication.class, args);
    }
}

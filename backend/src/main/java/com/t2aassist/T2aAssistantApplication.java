package com.t2aassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class T2aAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(T2aAssistantApplication.class, args);
    }
}

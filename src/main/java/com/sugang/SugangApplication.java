package com.sugang;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SugangApplication {

    public static void main(String[] args) {
        SpringApplication.run(SugangApplication.class, args);
    }
}

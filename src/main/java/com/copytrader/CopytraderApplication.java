package com.copytrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CopytraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CopytraderApplication.class, args);
    }
}

package com.whodunit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WhodunitApplication {

    public static void main(String[] args) {
        SpringApplication.run(WhodunitApplication.class, args);
    }
}

package com.bit.poa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.bit.poa")
public class PoaApplication {
    public static void main(String[] args) {
        SpringApplication.run(PoaApplication.class, args);
    }
}

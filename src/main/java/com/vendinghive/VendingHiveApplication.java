package com.vendinghive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class VendingHiveApplication {
    public static void main(String[] args) {
        SpringApplication.run(VendingHiveApplication.class, args);
    }
}

package com.oracle.lats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class SpringAiLatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpringAiLatsApplication.class, args);
    }
}

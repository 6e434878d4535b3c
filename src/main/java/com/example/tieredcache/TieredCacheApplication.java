package com.example.tieredcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TieredCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(TieredCacheApplication.class, args);
    }
}

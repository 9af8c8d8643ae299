package org.example.stylelock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StyleLockApplication {

    public static void main(String[] args) {
        SpringApplication.run(StyleLockApplication.class, args);
    }
}

package dev.safeurl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SafeUrlApplication {

    public static void main(String[] args) {
        SpringApplication.run(SafeUrlApplication.class, args);
    }
}

package com.moonscribe.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MoonscribeRagServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(MoonscribeRagServiceApplication.class, args);
    }
}

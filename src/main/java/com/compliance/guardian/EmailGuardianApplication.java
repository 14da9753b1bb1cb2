package com.compliance.guardian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmailGuardianApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailGuardianApplication.class, args);
    }
}

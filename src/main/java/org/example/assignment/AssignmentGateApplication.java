package org.example.assignment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssignmentGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssignmentGateApplication.class, args);
    }
}

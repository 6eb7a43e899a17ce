package com.example.repoassist;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RepoAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepoAssistApplication.class, args);
    }
}

package com.resumeForge.cvRenderer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResumeRendererApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeRendererApplication.class, args);
    }
}

package com.canvaslink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CanvasLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(CanvasLinkApplication.class, args);
    }
}

package com.example.podcast_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class PodcastBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PodcastBackendApplication.class, args);
    }

}

package com.mycontent.reco;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentRecommenderApplication {
    public static void main(String[] args) {
        SpringApplication.run(ContentRecommenderApplication.class, args);
    }
}

package com.streetview.crawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreetViewCrawlerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreetViewCrawlerApplication.class, args);
    }
}

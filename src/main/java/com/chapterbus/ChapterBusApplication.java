package com.chapterbus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChapterBusApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChapterBusApplication.class, args);
    }
}

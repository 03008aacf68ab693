package com.example.epubgloss;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EpubGlossApplication {

    public static void main(String[] args) {
        SpringApplication.run(EpubGlossApplication.class, args);
    }
}

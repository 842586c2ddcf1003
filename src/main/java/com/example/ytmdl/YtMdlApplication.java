package com.example.ytmdl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class YtMdlApplication {
    public static void main(String[] args) {
        SpringApplication.run(YtMdlApplication.class, args);
    }
}

package com.couchapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CouchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CouchApplication.class, args);
    }
}

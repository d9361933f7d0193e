package com.example.khaznati_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KhaznatiBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(KhaznatiBackendApplication.class, args);
    }

}

package com.example.formreader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class FormReaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormReaderApplication.class, args);
    }

}

package com.ihcstruct;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IhcStructurerApplication {

    public static void main(String[] args) {
        SpringApplication.run(IhcStructurerApplication.class, args);
    }
}

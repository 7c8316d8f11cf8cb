package com.ias.distributor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DistributorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DistributorServiceApplication.class, args);
    }
}

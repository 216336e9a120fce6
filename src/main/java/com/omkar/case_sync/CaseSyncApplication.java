package com.omkar.case_sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CaseSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseSyncApplication.class, args);
    }
}

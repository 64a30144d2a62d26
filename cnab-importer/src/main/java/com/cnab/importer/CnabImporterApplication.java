package com.cnab.importer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class CnabImporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CnabImporterApplication.class, args);
    }
}

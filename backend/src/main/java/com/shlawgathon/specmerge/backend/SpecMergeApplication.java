package com.shlawgathon.specmerge.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SpecMergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpecMergeApplication.class, args);
    }
}

package com.kgbio.lookup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KgBioLookupApplication {
    public static void main(String[] args) {
        SpringApplication.run(KgBioLookupApplication.class, args);
    }
}

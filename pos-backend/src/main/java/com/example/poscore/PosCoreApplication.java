package com.example.poscore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@ConfigurationPropertiesScan
@EntityScan("com.example.poscore")
@EnableJpaRepositories("com.example.poscore")
public class PosCoreApplication {
    public static void main(String[] args) {
        SpringApplication.run(PosCoreApplication.class, args);
    }
}

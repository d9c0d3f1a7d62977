package com.example.logpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LogPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogPipelineApplication.class, args);
    }

}

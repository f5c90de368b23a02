package com.chicu.gridbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GridBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridBotApplication.class, args);
    }
}

package com.mollang.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MollangPlaygroundApplication {

    public static void main(String[] args) {
        SpringApplication.run(MollangPlaygroundApplication.class, args);
    }
}

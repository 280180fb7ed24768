package com.aiinpocket.parkfinder;

import com.aiinpocket.parkfinder.config.ParkFinderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ParkFinderProperties.class)
public class ParkFinderApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParkFinderApplication.class, args);
    }

}

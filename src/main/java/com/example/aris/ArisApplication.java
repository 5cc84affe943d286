package com.example.aris;

import com.example.aris.config.FeedProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FeedProperties.class)
public class ArisApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArisApplication.class, args);
    }

}

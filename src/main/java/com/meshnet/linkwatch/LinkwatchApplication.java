package com.meshnet.linkwatch;

import com.meshnet.linkwatch.config.LinkwatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LinkwatchProperties.class)
public class LinkwatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkwatchApplication.class, args);
    }
}

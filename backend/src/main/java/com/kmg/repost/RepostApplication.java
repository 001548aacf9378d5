package com.kmg.repost;

import com.kmg.repost.config.RepostProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RepostProperties.class)
public class RepostApplication {
    public static void main(String[] args) {
        SpringApplication.run(RepostApplication.class, args);
    }
}

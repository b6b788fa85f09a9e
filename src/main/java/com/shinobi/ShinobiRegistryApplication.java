package com.shinobi;

import com.shinobi.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class ShinobiRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShinobiRegistryApplication.class, args);
    }
}

package com.example.abac;

import com.example.abac.config.properties.AbacCacheProperties;
import com.example.abac.config.properties.AbacProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AbacProperties.class, AbacCacheProperties.class})
public class AbacApplication {

    public static void main(String[] args) {
        SpringApplication.run(AbacApplication.class, args);
    }

}

package org.profilekit;

import org.profilekit.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(AppProperties.class)
@SpringBootApplication
public class ProfileKitApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProfileKitApplication.class, args);
    }
}

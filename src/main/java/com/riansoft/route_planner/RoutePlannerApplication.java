package com.riansoft.route_planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import com.riansoft.route_planner.config.RoutePlannerProperties;

@SpringBootApplication
@EnableConfigurationProperties(RoutePlannerProperties.class)
public class RoutePlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoutePlannerApplication.class, args);
    }
}

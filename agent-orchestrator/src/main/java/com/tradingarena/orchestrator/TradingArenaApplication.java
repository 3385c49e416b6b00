package com.tradingarena.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TradingArenaApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradingArenaApplication.class, args);
    }
}

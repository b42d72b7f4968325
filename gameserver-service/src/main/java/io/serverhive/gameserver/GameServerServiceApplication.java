package io.serverhive.gameserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan(basePackages = "io.serverhive.gameserver.config")
public class GameServerServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(GameServerServiceApplication.class, args);
    }
}

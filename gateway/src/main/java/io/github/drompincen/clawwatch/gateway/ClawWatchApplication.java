package io.github.drompincen.clawwatch.gateway;

import io.github.drompincen.clawwatch.gateway.config.ListenerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.clawwatch.gateway")
@EnableMongoRepositories(basePackages = "io.github.drompincen.clawwatch.persistence.repository")
@EnableConfigurationProperties(ListenerProperties.class)
@EnableScheduling
public class ClawWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClawWatchApplication.class, args);
    }
}

package io.github.drompincen.planloop.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.planloop")
@EnableMongoRepositories(basePackages = "io.github.drompincen.planloop.persistence.repository")
@EnableScheduling
public class PlanloopApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanloopApplication.class, args);
    }
}

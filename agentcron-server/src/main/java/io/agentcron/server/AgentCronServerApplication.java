package io.agentcron.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentCronServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentCronServerApplication.class, args);
    }
}

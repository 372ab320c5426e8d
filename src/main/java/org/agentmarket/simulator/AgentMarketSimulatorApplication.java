package org.agentmarket.simulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentMarketSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentMarketSimulatorApplication.class, args);
    }

}

package ai.agentmarket.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentMarketApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentMarketApplication.class, args);
    }
}

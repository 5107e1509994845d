package tw.gc.strategy.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StrategyOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyOptimizerApplication.class, args);
    }
}

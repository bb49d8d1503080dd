package by.greenmobile.ewjam;

import by.greenmobile.ewjam.config.OptimizerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(value = {OptimizerProperties.class})
@SpringBootApplication
public class EwJamApplication {

    public static void main(String[] args) {
        SpringApplication.run(EwJamApplication.class, args);
    }

}

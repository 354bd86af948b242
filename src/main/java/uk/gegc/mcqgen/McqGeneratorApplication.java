package uk.gegc.mcqgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class McqGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(McqGeneratorApplication.class, args);
    }
}

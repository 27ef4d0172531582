package com.electionlens.boothrecon;

import com.electionlens.boothrecon.config.properties.ContestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ContestProperties.class)
public class BoothReconApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoothReconApplication.class, args);
    }

}

package io.fieldledger.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(scanBasePackages = "io.fieldledger.api")
@EnableConfigurationProperties(FieldLedgerProperties.class)
public class FlApplication {
    public static void main(String[] args) {
        SpringApplication.run(FlApplication.class, args);
    }
}

package com.civicintel.servicerequest;

import com.civicintel.servicerequest.config.IngestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(IngestProperties.class)
public class ServiceRequestIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServiceRequestIngestApplication.class, args);
    }
}

package uk.gegc.videobatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VideoBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideoBatchApplication.class, args);
    }
}

package com.phillippitts.docingest;

import com.phillippitts.docingest.config.properties.ApiClientProperties;
import com.phillippitts.docingest.config.properties.IngestionProperties;
import com.phillippitts.docingest.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        IngestionProperties.class,
        ApiClientProperties.class,
        ThreadPoolProperties.class
})
public class DocIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocIngestApplication.class, args);
    }

}

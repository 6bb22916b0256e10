package com.orthosense;

import com.orthosense.config.properties.AnalysisProperties;
import com.orthosense.config.properties.ClassifierProperties;
import com.orthosense.config.properties.FeedbackProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AnalysisProperties.class,
        ClassifierProperties.class,
        FeedbackProperties.class
})
public class OrthoSenseApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrthoSenseApplication.class, args);
    }

}

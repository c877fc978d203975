package edu.harvard.hms.dbmi.avillach.synth.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@ComponentScan("edu.harvard.hms.dbmi.avillach.synth")
public class SyntheticVitalsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyntheticVitalsApplication.class, args);
    }

}

package org.areaflow.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AreaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AreaEngineApplication.class, args);
    }
}

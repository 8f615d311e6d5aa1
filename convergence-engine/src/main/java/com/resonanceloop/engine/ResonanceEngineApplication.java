package com.resonanceloop.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class ResonanceEngineApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(ResonanceEngineApplication.class);
        boolean cliMode = Arrays.asList(args).contains("--cli.enabled=true");
        if (cliMode) {
            app.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = app.run(args);
        if (cliMode) {
            System.exit(SpringApplication.exit(context));
        }
    }
}

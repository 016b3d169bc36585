package com.skillflow.gateway;

import com.skillflow.shared.config.ConfigLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.skillflow.gateway")
public class SkillFlowApp {

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(SkillFlowApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.run(args);
    }
}

package com.skillflow.gateway;

import com.skillflow.engine.SkillEngine;
import com.skillflow.shared.config.ConfigLoader;
import com.skillflow.shared.config.SkillFlowConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    @Bean
    public SkillFlowConfig skillFlowConfig() {
        return ConfigLoader.load();
    }

    @Bean(destroyMethod = "shutdown")
    public SkillEngine skillEngine(SkillFlowConfig config) {
        return SkillEngine.create(config);
    }
}

package org.csu.minipy.config;

import org.csu.minipy.engine.FrontendProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FrontendConfig {

    /**
     * FrontendProcessor 只持有不可变配置，整个应用共享一个实例。
     */
    @Bean
    public FrontendProcessor frontendProcessor(AnalyzerProperties properties) {
        return new FrontendProcessor(properties.tabWidth());
    }
}

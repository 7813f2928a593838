package com.resumeForge.cvRenderer.style.config;

import com.resumeForge.cvRenderer.style.model.StyleRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StyleConfig {

    // Single, load-once style catalogue shared by all render passes
    @Bean
    public StyleRegistry styleRegistry() {
        return StyleRegistry.standard();
    }
}

package com.unifiedplatform.backend.global.config;

import com.unifiedplatform.backend.global.web.RequestIdFilter;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(PlatformProperties.class)
public class WebCorsConfig implements WebMvcConfigurer {

    private final PlatformProperties properties;

    public WebCorsConfig(PlatformProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(properties.cors().allowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Location", RequestIdFilter.REQUEST_ID_HEADER)
                .allowCredentials(true);
    }
}

package com.unifiedplatform.backend.global.config;

import com.unifiedplatform.backend.global.common.time.TimeConfig;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = "com.unifiedplatform.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = TimeConfig.AUDITING_DATE_TIME_PROVIDER)
public class JpaConfig {
}

package com.ospicorp.planningcube.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CubeProperties.class)
public class CubeConfig {

  @Bean
  Clock cubeClock() {
    return Clock.systemUTC();
  }
}

/*
 * Where: Shared configuration
 * What: Exposes the process Clock as a bean
 * Why: Schedulers, retention windows and tests all read time through one injectable source
 */
package com.logimetrics.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}

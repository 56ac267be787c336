package com.dnmm.pool.events;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods=false)
public class DnmmEventsConfiguration {

  @Bean
  @ConditionalOnProperty(prefix="dnmm.events", name="enabled", havingValue="false", matchIfMissing=true)
  @ConditionalOnMissingBean(DnmmEventPublisher.class)
  public DnmmEventPublisher noopDnmmEventPublisher() {
    return new NoopDnmmEventPublisher();
  }
}

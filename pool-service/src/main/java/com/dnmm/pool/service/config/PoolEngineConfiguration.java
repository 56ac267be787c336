package com.dnmm.pool.service.config;

import com.dnmm.pool.config.DnmmProperties;
import com.dnmm.pool.config.InMemoryParameterStore;
import com.dnmm.pool.engine.LedgerClock;
import com.dnmm.pool.engine.PoolEngine;
import com.dnmm.pool.engine.SystemLedgerClock;
import com.dnmm.pool.events.DnmmEventPublisher;
import com.dnmm.pool.oracle.OracleAdapter;
import com.dnmm.pool.service.oracle.PaperOracleProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class PoolEngineConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public LedgerClock ledgerClock(Clock clock, PaperOracleProperties paper) {
    return new SystemLedgerClock(clock, paper.blockTimeMillis());
  }

  @Bean
  public InMemoryParameterStore parameterStore(DnmmProperties properties) {
    return new InMemoryParameterStore(properties);
  }

  @Bean
  public PoolEngine poolEngine(
      InMemoryParameterStore parameterStore,
      OracleAdapter oracleAdapter,
      LedgerClock ledgerClock,
      DnmmEventPublisher events
  ) {
    return new PoolEngine(parameterStore, oracleAdapter, ledgerClock, events);
  }
}

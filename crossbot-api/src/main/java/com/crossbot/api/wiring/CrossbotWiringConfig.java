package com.crossbot.api.wiring;

import com.crossbot.application.config.BotSettings;
import com.crossbot.application.config.BotSettingsLoader;
import com.crossbot.application.execution.impl.DefaultJobScheduler;
import com.crossbot.application.ports.ConfigPort;
import com.crossbot.application.ports.PriceSourcePort;
import com.crossbot.application.service.BotController;
import com.crossbot.domain.strategy.StrategyRegistry;
import com.crossbot.infrastructure.config.FileConfigService;
import com.crossbot.infrastructure.marketdata.PriceSources;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class CrossbotWiringConfig {

  @Bean
  public ConfigPort configPort(@Value("${crossbot.config-dir:config}") String configDir) throws IOException {
    return FileConfigService.fromDirectory(Path.of(configDir));
  }

  @Bean
  public StrategyRegistry strategyRegistry() {
    return StrategyRegistry.withDefaults();
  }

  /** Invalid configuration fails application startup. */
  @Bean
  public BotSettings botSettings(ConfigPort config, StrategyRegistry strategies) {
    return new BotSettingsLoader(strategies).load(config);
  }

  @Bean
  public PriceSourcePort priceSource(ConfigPort config) {
    return PriceSources.fromConfig(config);
  }

  @Bean(destroyMethod = "shutdown")
  public DefaultJobScheduler jobScheduler() {
    return new DefaultJobScheduler();
  }

  /** Stopped by {@link BotShutdownHook}, not by the inferred close(). */
  @Bean(destroyMethod = "")
  public BotController botController(BotSettings settings,
                                     StrategyRegistry strategies,
                                     PriceSourcePort prices,
                                     DefaultJobScheduler scheduler) {
    return new BotController(settings, strategies, prices, scheduler, Clock.systemUTC());
  }
}

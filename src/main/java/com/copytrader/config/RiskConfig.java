package com.copytrader.config;

import com.copytrader.risk.TopUpLimits;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.Assert;

/**
 * Provides the {@link TopUpLimits} bean from application.properties.
 *
 * <p>Both ceilings are mandatory and must be positive; a misconfigured cap fails startup
 * before any socket or worker thread is started.
 *
 * <p>Properties prefix: {@code copytrader.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public TopUpLimits topUpLimits(
            @Value("${copytrader.risk.max-topup-per-trade:1000000}") long maxTopUpPerTrade,
            @Value("${copytrader.risk.max-topup-per-symbol:10000000}") long maxTopUpPerSymbol) {
        Assert.isTrue(maxTopUpPerTrade > 0, "copytrader.risk.max-topup-per-trade must be positive");
        Assert.isTrue(maxTopUpPerSymbol > 0, "copytrader.risk.max-topup-per-symbol must be positive");
        return TopUpLimits.builder()
                .maxTopUpPerTrade(maxTopUpPerTrade)
                .maxTopUpPerSymbol(maxTopUpPerSymbol)
                .build();
    }
}

package com.copytrader.config;

import com.copytrader.domain.enums.OrderType;
import com.copytrader.domain.enums.TimeInForce;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Replication behaviour: multiplier, symbol allow-list, order shape, self-tagging,
 * queue size and dedup windows.
 *
 * <p>Properties prefix: {@code copytrader.replication.*}
 */
@Configuration
@ConfigurationProperties(prefix = "copytrader.replication")
@Validated
@Getter
@Setter
public class ReplicationConfig {

    public static final String ALL_SYMBOLS = "ALL";

    /** Target position multiple. 2.0 doubles every fill; 1.0 or less disables top-ups. */
    private double multiplier = 2.0;

    /** Log orders instead of sending them. */
    private boolean dryRun = false;

    /** Comma-separated symbols to replicate, or ALL. */
    @NotBlank
    private String allowSymbols = ALL_SYMBOLS;

    @NotNull
    private OrderType orderType = OrderType.MARKET_ORDER;

    @NotNull
    private TimeInForce timeInForce = TimeInForce.IOC;

    /** Basis points added to (buy) or subtracted from (sell) the reference price of limit orders. */
    @DecimalMin("0.0")
    private double limitSlippageBps = 0.0;

    /** Resubmit as market when a limit IOC is cancelled for lack of book depth. */
    private boolean limitIocFallbackMarket = true;

    /** Prefix of every client order id this service sends; events carrying it are ignored. */
    @NotBlank
    private String selfTagPrefix = "BOTMULT_";

    /** When false, skip records are not written to the decision log. */
    private boolean verboseDecisions = true;

    @Min(1)
    private int queueCapacity = 1000;

    @Valid
    private Dedup dedup = new Dedup();

    @AssertTrue(message = "multiplier must be a finite number")
    public boolean isMultiplierFinite() {
        return Double.isFinite(multiplier);
    }

    /** Upper-cased allow-list entries, blanks dropped. */
    public Set<String> allowedSymbols() {
        return Arrays.stream(allowSymbols.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Wall clock for dedup expiry and audit timestamps. */
    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Getter
    @Setter
    public static class Dedup {

        @NotNull
        private Duration fillIdTtl = Duration.ofHours(24);

        @Min(1)
        private int fillIdMax = 200_000;

        @NotNull
        private Duration tradeIdTtl = Duration.ofHours(24);

        @Min(1)
        private int tradeIdMax = 200_000;
    }
}

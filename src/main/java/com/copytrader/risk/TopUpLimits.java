package com.copytrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * Ceilings applied to top-up orders.
 *
 * <ul>
 *   <li>{@code maxTopUpPerTrade} -- the largest single top-up; larger computed sizes are clamped</li>
 *   <li>{@code maxTopUpPerSymbol} -- total contracts that may be replicated per symbol this session</li>
 * </ul>
 */
@Getter
@Builder
public class TopUpLimits {

    private final long maxTopUpPerTrade;

    private final long maxTopUpPerSymbol;
}

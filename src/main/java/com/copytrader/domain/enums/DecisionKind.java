package com.copytrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Top-level discriminator of an audit record.
 *
 * <ul>
 *   <li>SKIP -- an admission check or validation declined to act</li>
 *   <li>ACTION -- something was done (frame sent, job enqueued, order submitted)</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum DecisionKind {
    SKIP("skip"),
    ACTION("action");

    private final String wireValue;
}

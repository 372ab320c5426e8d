package org.agentmarket.simulator.core.sizing;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SizingMethod {
    FIXED_FRACTION("FixedFraction"),
    KELLY("Kelly");

    private final String label;
}

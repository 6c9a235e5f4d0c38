package com.bank.payout.model;

import java.util.Arrays;
import java.util.Optional;

public enum DestinationNetwork {
    FANTOM,
    ETHEREUM,
    POLYGON,
    BSC,
    BITCOIN;

    public static Optional<DestinationNetwork> parse(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(n -> n.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}

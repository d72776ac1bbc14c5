package com.whatshouldido.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 예산 수준. ordinal 값이 허용되는 최대 price level (0-4)과 같다.
 */
public enum BudgetLevel {
    FREE,
    INEXPENSIVE,
    MODERATE,
    EXPENSIVE,
    VERY_EXPENSIVE;

    public int maxPriceLevel() {
        return ordinal();
    }

    public static Optional<BudgetLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(level -> level.name().equals(normalized))
                .findFirst();
    }
}

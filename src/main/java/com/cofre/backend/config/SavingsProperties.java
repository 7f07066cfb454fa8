package com.cofre.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cofre.savings")
public record SavingsProperties(
        Integer recentTransactionsLimit,
        Integer statisticsMonths,
        Integer defaultPageSize,
        Integer maxPageSize
) {
    public SavingsProperties {
        if (recentTransactionsLimit == null || recentTransactionsLimit <= 0) {
            recentTransactionsLimit = 5;
        }
        if (statisticsMonths == null || statisticsMonths <= 0) {
            statisticsMonths = 6;
        }
        if (defaultPageSize == null || defaultPageSize <= 0) {
            defaultPageSize = 20;
        }
        if (maxPageSize == null || maxPageSize <= 0) {
            maxPageSize = 100;
        }
    }

    public static SavingsProperties defaults() {
        return new SavingsProperties(null, null, null, null);
    }
}

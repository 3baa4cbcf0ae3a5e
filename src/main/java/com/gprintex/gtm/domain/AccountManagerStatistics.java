package com.gprintex.gtm.domain;

import java.math.BigDecimal;

public record AccountManagerStatistics(
    String accountManager,
    long totalAgreements,
    long signedAgreements,
    BigDecimal signedValue,
    BigDecimal monetizedValue,
    BigDecimal utilization
) {
}

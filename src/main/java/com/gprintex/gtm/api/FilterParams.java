package com.gprintex.gtm.api;

import com.gprintex.gtm.domain.AgreementStatus;
import com.gprintex.gtm.domain.CustomerSegment;
import com.gprintex.gtm.domain.LedgerError;
import com.gprintex.gtm.domain.LedgerError.ValidationError;
import com.gprintex.gtm.domain.ValidationResult;
import com.gprintex.gtm.repository.AgreementRepository.AgreementFilter;
import io.vavr.control.Either;

import java.util.List;

/**
 * Query parameters shared by the agreement list and the analytics endpoints.
 */
public record FilterParams(
    String status,
    String accountManager,
    String customerName,
    String region,
    String industry,
    String customerSegment
) {
    public Either<LedgerError, AgreementFilter> toFilter() {
        var filter = AgreementFilter.all();
        if (present(status)) {
            var parsed = AgreementStatus.fromLabel(status);
            if (parsed.isEmpty()) {
                return invalid("status", status);
            }
            filter = filter.withStatus(parsed.get());
        }
        if (present(customerSegment)) {
            var parsed = CustomerSegment.fromLabel(customerSegment);
            if (parsed.isEmpty()) {
                return invalid("customerSegment", customerSegment);
            }
            filter = filter.withCustomerSegment(parsed.get());
        }
        if (present(accountManager)) filter = filter.withAccountManager(accountManager);
        if (present(customerName)) filter = filter.withCustomerName(customerName);
        if (present(region)) filter = filter.withRegion(region);
        if (present(industry)) filter = filter.withIndustry(industry);
        return Either.right(filter);
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static Either<LedgerError, AgreementFilter> invalid(String field, String value) {
        return Either.left(new ValidationError(List.of(ValidationResult.invalidValue(field, value))));
    }
}

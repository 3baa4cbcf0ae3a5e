package com.gprintex.gtm.api;

import com.gprintex.gtm.domain.LedgerError;
import com.gprintex.gtm.domain.LedgerError.CeilingExceeded;
import com.gprintex.gtm.domain.LedgerError.InvalidTransition;
import com.gprintex.gtm.domain.LedgerError.NotFound;
import com.gprintex.gtm.domain.LedgerError.ValidationError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps ledger rejections to HTTP responses.
 */
final class LedgerResponses {

    private LedgerResponses() {
    }

    static HttpStatus statusOf(LedgerError error) {
        if (error instanceof ValidationError) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof NotFound) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof InvalidTransition) {
            return HttpStatus.CONFLICT;
        }
        if (error instanceof CeilingExceeded) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ResponseEntity<Object> error(LedgerError error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", error.code());
        body.put("error", error.message());
        if (error instanceof ValidationError validation) {
            body.put("violations", validation.violations());
        }
        if (error instanceof CeilingExceeded ceiling) {
            body.put("currentTotal", ceiling.currentTotal());
            body.put("newPoValue", ceiling.newPoValue());
            body.put("ceiling", ceiling.ceiling());
        }
        return ResponseEntity.status(statusOf(error)).body(body);
    }

    static ResponseEntity<Object> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}

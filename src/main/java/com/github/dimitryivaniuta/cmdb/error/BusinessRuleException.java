package com.github.dimitryivaniuta.cmdb.error;

import org.springframework.http.HttpStatus;

import java.util.List;

public class BusinessRuleException extends CmdbException {

    public static final String CODE = "BUSINESS_RULE_VIOLATION";

    public BusinessRuleException(List<ErrorDetail> errors) {
        super(HttpStatus.BAD_REQUEST, "Business rule validation failed", errors);
    }
}

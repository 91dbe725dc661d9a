package com.openscheduling.availability.domain.model;

import java.util.List;

public record ValidationResult(boolean valid, List<ValidationReason> reasons) {

    public ValidationResult {
        reasons = List.copyOf(reasons);
    }

    public static ValidationResult of(List<ValidationReason> reasons) {
        return new ValidationResult(reasons.isEmpty(), reasons);
    }

    public List<String> reasonCodes() {
        return reasons.stream().map(ValidationReason::code).toList();
    }
}

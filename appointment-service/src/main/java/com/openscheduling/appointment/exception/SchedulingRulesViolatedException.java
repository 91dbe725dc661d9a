package com.openscheduling.appointment.exception;

import com.openscheduling.availability.domain.model.ValidationReason;
import com.openscheduling.common.exception.BusinessException;
import lombok.Getter;

import java.util.List;

/**
 * A booking request broke one or more scheduling rules. Carries every violated rule.
 */
@Getter
public class SchedulingRulesViolatedException extends BusinessException {

    public static final String ERROR_CODE = "SCHEDULING_RULES_VIOLATED";

    private final List<ValidationReason> reasons;

    public SchedulingRulesViolatedException(List<ValidationReason> reasons) {
        super("Scheduling rules violated: " + reasons.stream().map(ValidationReason::code).toList(), ERROR_CODE);
        this.reasons = List.copyOf(reasons);
    }
}

package com.deliverydispatch.dispatch.model;

public enum AssignmentOutcome {
    ASSIGNED,
    NO_ELIGIBLE_DRIVER
}

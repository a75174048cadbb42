package com.deliverydispatch.shared.enums;

public enum VerificationStatus {
    PENDING,
    VERIFIED,
    REJECTED
}

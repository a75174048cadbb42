package com.deliverydispatch.shared.enums;

import java.util.Locale;

public enum PresenceStatus {
    ONLINE,
    OFFLINE;

    public static PresenceStatus of(boolean online) {
        return online ? ONLINE : OFFLINE;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.chatrelay.providers;

import java.util.Locale;

public enum Tier {
    PRIMARY,
    SECONDARY,
    FALLBACK;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.modelgate.promotion;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PromotionOutcome {
    PROMOTE,
    REJECT,
    SKIP;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PromotionOutcome fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}

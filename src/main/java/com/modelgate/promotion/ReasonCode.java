package com.modelgate.promotion;

public enum ReasonCode {
    FAILED_GATES("failed_gates"),
    NOT_BETTER_THAN_CHAMPION("not_better_than_champion");

    private final String code;

    ReasonCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}

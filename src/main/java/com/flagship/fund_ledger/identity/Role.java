package com.flagship.fund_ledger.identity;

import java.util.Arrays;

/**
 * Role levels of the organization hierarchy. Lower levels manage higher ones.
 */
public enum Role {
    DEVELOPER(1),
    ENGINEER(2),
    SUPERVISOR(3),
    WORKER(4);

    private final int level;

    Role(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Engineers and supervisors hold wallets and manage a team; developers sit above them.
     */
    public boolean isManager() {
        return this == ENGINEER || this == SUPERVISOR;
    }

    public static Role fromLevel(int level) {
        return Arrays.stream(values())
            .filter(role -> role.level == level)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown role level: " + level));
    }
}

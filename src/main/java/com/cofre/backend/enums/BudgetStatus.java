package com.cofre.backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum BudgetStatus {
    UPCOMING,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    /** Status que não participam mais de checagem de sobreposição. */
    public static final Set<BudgetStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}

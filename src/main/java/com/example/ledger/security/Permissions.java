package com.example.ledger.security;

/**
 * Permission names checked by the ledger.
 * Use these instead of string literals for compile-time safety.
 */
public final class Permissions {

    private Permissions() {
    }

    // Full access within an organization
    public static final String ADMIN = "ADMIN";

    // Reopening a closed or locked fiscal period undoes the lock guarantee
    public static final String REOPEN_PERIOD = "REOPEN_PERIOD";

    public static final String POST_JOURNAL = "POST_JOURNAL";
    public static final String MANAGE_PERIODS = "MANAGE_PERIODS";
    public static final String RECONCILE_BANK = "RECONCILE_BANK";
    public static final String VIEW_REPORTS = "VIEW_REPORTS";

    /** Authority string for a permission held in one organization only, e.g. {@code REOPEN_PERIOD@42}. */
    public static String scoped(String permission, Long orgId) {
        return permission + "@" + orgId;
    }
}

package com.example.ledger.domain;

/** Cash drawer movements reported by the point of sale. */
public enum CashMovementType {
    PAID_IN,     // Cash added to the drawer from the owner
    PAID_OUT,    // Cash taken out for a small expense or draw
    SAFE_DROP,   // Drawer cash moved to the safe
    PICKUP;      // Safe cash collected for banking

    public boolean increasesCash() {
        return this == PAID_IN;
    }
}

package com.questrail.phaseseq.registration;

import java.util.Objects;

/**
 * Translation of one frame transition, as reported by the registration tool.
 *
 * <p>The components keep the tool's own decimal text so the rewritten log
 * reproduces the values exactly; {@link #dx()} and {@link #dy()} give the
 * parsed numbers.</p>
 */
public record RegistrationShift(String tx, String ty) {
    public RegistrationShift {
        Objects.requireNonNull(tx, "tx");
        Objects.requireNonNull(ty, "ty");
    }

    public double dx() {
        return Double.parseDouble(tx);
    }

    public double dy() {
        return Double.parseDouble(ty);
    }

    /**
     * The {@code tx,ty} line written to the rewritten log (without newline).
     */
    public String toLogLine() {
        return tx + "," + ty;
    }
}

package org.stockadvisor.analysis.model;

import java.util.Objects;

/**
 * Safety classifications for one instrument. They flag conditions; turning a
 * flag into an action (for example downgrading a buy) is left to the caller.
 */
public final class SafetyFlags {
    private final boolean surge;
    private final boolean dangerous;
    private final boolean overheated;
    private final boolean inDecline;

    public SafetyFlags(boolean surge, boolean dangerous, boolean overheated, boolean inDecline) {
        this.surge = surge;
        this.dangerous = dangerous;
        this.overheated = overheated;
        this.inDecline = inDecline;
    }

    public boolean isSurge() { return surge; }
    public boolean isDangerous() { return dangerous; }
    public boolean isOverheated() { return overheated; }
    public boolean isInDecline() { return inDecline; }

    public boolean anyRaised() {
        return surge || dangerous || overheated || inDecline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SafetyFlags)) return false;
        SafetyFlags that = (SafetyFlags) o;
        return surge == that.surge && dangerous == that.dangerous &&
            overheated == that.overheated && inDecline == that.inDecline;
    }

    @Override
    public int hashCode() {
        return Objects.hash(surge, dangerous, overheated, inDecline);
    }

    @Override
    public String toString() {
        return "SafetyFlags{surge=" + surge + ", dangerous=" + dangerous +
            ", overheated=" + overheated + ", inDecline=" + inDecline + "}";
    }
}

package com.taleforge.mechanics.check;

/**
 * Two opposed checks. The initiating actor wins ties.
 */
public record ContestResult(
    CheckResult actor,
    CheckResult target
) {
    public boolean actorWins() {
        return actor.total() >= target.total();
    }

    public boolean tied() {
        return actor.total() == target.total();
    }

    public int margin() {
        return actor.total() - target.total();
    }
}

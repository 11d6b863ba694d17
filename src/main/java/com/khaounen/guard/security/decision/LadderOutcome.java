package com.khaounen.guard.security.decision;

public record LadderOutcome(EnforcementState from, EnforcementState to, ReasonCode reason, boolean violating) {

    public boolean changed() {
        return from != to;
    }

    public boolean promoted() {
        return to.severity() > from.severity();
    }

    public boolean crossedBlock() {
        return from.isBlocking() != to.isBlocking();
    }
}

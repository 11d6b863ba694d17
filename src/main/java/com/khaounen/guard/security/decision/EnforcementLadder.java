package com.khaounen.guard.security.decision;

/**
 * Pure transition logic of the Clean, Watched, Throttled, Challenged, Blocked ladder.
 *
 * <p>Streaks are counted per evaluation window: a window is violating once any evaluation in it
 * saw the rate above the threshold. Windows with no evaluation at all count as clean. A violating
 * window only counts once, however many events it carried.
 */
public class EnforcementLadder {

    private final LadderPolicy policy;

    public EnforcementLadder(LadderPolicy policy) {
        this.policy = policy;
    }

    public LadderPolicy policy() {
        return policy;
    }

    /**
     * Advances {@code state} in place for an evaluation at {@code nowMillis}.
     */
    public LadderOutcome advance(IdentityState state, long windowIndex, long nowMillis, double rate, double threshold) {
        EnforcementState from = state.getState();
        closeWindows(state, windowIndex);
        boolean violating = rate > threshold;
        ReasonCode reason = null;

        if (!violating && state.getState() != EnforcementState.CLEAN
                && state.getCleanStreak() >= policy.demoteAfterCleanWindows()) {
            moveTo(state, EnforcementState.CLEAN, nowMillis);
            reason = ReasonCode.RECOVERED;
        } else if (!violating && state.getState().isEnforcing() && state.getHoldUntil() <= nowMillis) {
            moveTo(state, state.getState().lenient(), nowMillis);
            reason = ReasonCode.HOLD_EXPIRED;
        }

        if (violating) {
            if (!state.isWindowViolated()) {
                state.setWindowViolated(true);
                state.setViolationStreak(saturatedAdd(state.getViolationStreak(), 1));
                state.setCleanStreak(0);
                if (state.getState().isEnforcing()) {
                    long refreshed = nowMillis + policy.holdFor(state.getState()).toMillis();
                    state.setHoldUntil(Math.max(state.getHoldUntil(), refreshed));
                }
            }
            if (policy.fastPathEnabled()
                    && state.getState() != EnforcementState.BLOCKED
                    && rate >= threshold * policy.fastPathMultiple()) {
                moveTo(state, EnforcementState.BLOCKED, nowMillis);
                reason = ReasonCode.EXTREME_RATE;
            } else if (state.getState() == EnforcementState.CLEAN
                    && state.getViolationStreak() >= policy.watchAfterWindows()) {
                moveTo(state, EnforcementState.WATCHED, nowMillis);
                reason = ReasonCode.RATE_EXCEEDED;
            } else if (state.getState() != EnforcementState.CLEAN
                    && state.getState() != EnforcementState.BLOCKED
                    && state.getViolationStreak() >= policy.promoteAfterWindows()) {
                moveTo(state, state.getState().stricter(), nowMillis);
                reason = ReasonCode.SUSTAINED_RATE;
            }
        }

        if (reason == null) {
            reason = violating ? ReasonCode.RATE_EXCEEDED : ReasonCode.steadyState(state.getState());
        }
        state.setLastReason(reason);
        state.setUpdatedAt(nowMillis);
        return new LadderOutcome(from, state.getState(), reason, violating);
    }

    private void closeWindows(IdentityState state, long windowIndex) {
        long last = state.getWindowIndex();
        if (last == windowIndex) {
            return;
        }
        if (last < 0) {
            state.setWindowIndex(windowIndex);
            state.setWindowViolated(false);
            return;
        }
        if (windowIndex < last) {
            // late event from an already closed window, count it against the open one
            return;
        }
        long idle = windowIndex - last - 1;
        if (state.isWindowViolated()) {
            if (idle > 0) {
                state.setViolationStreak(0);
                state.setCleanStreak(saturatedAdd(0, idle));
            }
        } else {
            state.setViolationStreak(0);
            state.setCleanStreak(saturatedAdd(state.getCleanStreak(), idle + 1));
        }
        state.setWindowIndex(windowIndex);
        state.setWindowViolated(false);
    }

    private void moveTo(IdentityState state, EnforcementState target, long nowMillis) {
        EnforcementState from = state.getState();
        state.setState(target);
        if (target == EnforcementState.CLEAN) {
            state.setViolationStreak(0);
            state.setCleanStreak(0);
            state.setHoldUntil(0L);
            return;
        }
        if (target.severity() > from.severity()) {
            state.setCleanStreak(0);
            if (target.isEnforcing()) {
                state.setViolationStreak(0);
            }
        }
        state.setHoldUntil(target.isEnforcing() ? nowMillis + policy.holdFor(target).toMillis() : 0L);
    }

    private static int saturatedAdd(long base, long increment) {
        return (int) Math.min(Integer.MAX_VALUE, base + increment);
    }
}

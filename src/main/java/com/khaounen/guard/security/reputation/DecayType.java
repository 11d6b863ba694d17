package com.khaounen.guard.security.reputation;

public enum DecayType {
    LINEAR,
    EXPONENTIAL
}

package com.khaounen.guard.security.filters;

import com.khaounen.guard.security.decision.Verdict;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

public interface ChallengeHandler {
    void handle(HttpServletRequest request, HttpServletResponse response, Verdict verdict) throws IOException;
}

package com.khaounen.guard.security.filters;

import com.khaounen.guard.security.decision.Verdict;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

public class DefaultChallengeHandler implements ChallengeHandler {
    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, Verdict verdict) throws IOException {
        response.setStatus(403);
        response.setContentType("text/plain");
        response.getWriter().write("Challenge required.");
    }
}

package com.armada.core.plan;

import java.util.List;

/**
 * Thrown when a plan document is structurally malformed. Carries every problem found,
 * not just the first.
 */
public class InvalidPlanException extends RuntimeException {

    private final List<String> problems;

    public InvalidPlanException(String source, List<String> problems) {
        super("Invalid plan " + source + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public InvalidPlanException(String source, String problem, Throwable cause) {
        super("Invalid plan " + source + ": " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }
}

package com.nnstudio.orchestrator.problem;

/**
 * Carries a {@link Problem} up the call stack until a caller turns it into
 * a user-facing result.
 */
public class ProblemException extends RuntimeException {

    private final Problem problem;

    public ProblemException(Problem problem) {
        super(problem.title() + (problem.detail() != null ? ": " + problem.detail() : ""));
        this.problem = problem;
    }

    public ProblemException(Problem problem, Throwable cause) {
        super(problem.title() + (problem.detail() != null ? ": " + problem.detail() : ""), cause);
        this.problem = problem;
    }

    public Problem problem() { return problem; }

    public int status() { return problem.status(); }
}

package com.whereq.forge.exception;

/**
 * Exception thrown when a user already holds the maximum number of active jobs
 */
public class QuotaExceededException extends RuntimeException {

    private final String userId;
    private final long activeJobs;
    private final int limit;

    public QuotaExceededException(String userId, long activeJobs, int limit) {
        super("User " + userId + " has " + activeJobs + " active jobs (limit " + limit + ")");
        this.userId = userId;
        this.activeJobs = activeJobs;
        this.limit = limit;
    }

    public String getUserId() {
        return userId;
    }

    public long getActiveJobs() {
        return activeJobs;
    }

    public int getLimit() {
        return limit;
    }
}

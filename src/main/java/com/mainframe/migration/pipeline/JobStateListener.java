package com.mainframe.migration.pipeline;

/**
 * Observer of job transitions, called in the order transitions happen.
 */
@FunctionalInterface
public interface JobStateListener {

    void onTransition(JobSnapshot previous, JobSnapshot current);
}

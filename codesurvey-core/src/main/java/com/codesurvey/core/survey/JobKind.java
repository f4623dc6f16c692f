package com.codesurvey.core.survey;

/**
 * Kind of work handled by the {@link JobScheduler}.
 */
public enum JobKind {
    /** Preparing a repository from a source. */
    REPO,
    /** Analyzing one unit of a repository. */
    CODE
}

package com.eyelevel.tableingestor.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The lifecycle states of an {@link IngestionJob}. Transitions only move forward; every
 * non-terminal state may fall through to {@link #FAILED}.
 */
public enum JobState {
    /**
     * The trigger arrived; the object is being fetched and hashed.
     */
    RECEIVED,
    CLASSIFYING,
    STRUCTURING,
    EXTRACTING,
    SCHEMA_READY,
    LOADING,
    COMPLETED,
    COMPLETED_WITH_WARNINGS,
    FAILED;

    private static final Map<JobState, Set<JobState>> SUCCESSORS = new EnumMap<>(JobState.class);

    static {
        // RECEIVED may jump straight to a successful terminal state when an identical upload was already ingested.
        SUCCESSORS.put(RECEIVED, EnumSet.of(CLASSIFYING, COMPLETED, COMPLETED_WITH_WARNINGS, FAILED));
        SUCCESSORS.put(CLASSIFYING, EnumSet.of(STRUCTURING, EXTRACTING, FAILED));
        SUCCESSORS.put(STRUCTURING, EnumSet.of(SCHEMA_READY, FAILED));
        SUCCESSORS.put(EXTRACTING, EnumSet.of(SCHEMA_READY, FAILED));
        SUCCESSORS.put(SCHEMA_READY, EnumSet.of(LOADING, FAILED));
        SUCCESSORS.put(LOADING, EnumSet.of(COMPLETED, COMPLETED_WITH_WARNINGS, FAILED));
        SUCCESSORS.put(COMPLETED, EnumSet.noneOf(JobState.class));
        SUCCESSORS.put(COMPLETED_WITH_WARNINGS, EnumSet.noneOf(JobState.class));
        SUCCESSORS.put(FAILED, EnumSet.noneOf(JobState.class));
    }

    public static final Set<JobState> SUCCESSFUL_TERMINAL_STATES = Collections.unmodifiableSet(
            EnumSet.of(COMPLETED, COMPLETED_WITH_WARNINGS));

    public boolean isTerminal() {
        return SUCCESSORS.get(this).isEmpty();
    }

    public boolean canTransitionTo(JobState next) {
        return SUCCESSORS.get(this).contains(next);
    }
}

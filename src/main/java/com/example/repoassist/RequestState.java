package com.example.repoassist;

/** States of the planner-executor loop for one request. */
public enum RequestState {
    IDLE,
    CLASSIFYING,
    PLANNING,
    EXECUTING,
    EVALUATING,
    SYNTHESIZING,
    DONE,
    INSUFFICIENT,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == INSUFFICIENT || this == FAILED;
    }
}

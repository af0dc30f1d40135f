package com.example.schedulerservice.jobs;

public enum ExecutionOutcome {
    SUCCESS, FAILURE
}

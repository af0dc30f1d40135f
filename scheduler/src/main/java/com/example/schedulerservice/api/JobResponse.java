package com.example.schedulerservice.api;

import com.example.schedulerservice.jobs.Job;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobResponse {
    private String status;
    private String name;
    private String message;
    private Job job;

    public JobResponse() {
    }

    public JobResponse(String status, String name, String message, Job job) {
        this.status = status;
        this.name = name;
        this.message = message;
        this.job = job;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }
}

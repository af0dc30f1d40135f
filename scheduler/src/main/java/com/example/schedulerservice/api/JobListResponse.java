package com.example.schedulerservice.api;

import com.example.schedulerservice.jobs.Job;

import java.util.ArrayList;
import java.util.List;

public class JobListResponse {
    private String status;
    private String message;
    private List<Job> jobs = new ArrayList<>();

    public JobListResponse() {
    }

    public JobListResponse(String status, String message, List<Job> jobs) {
        this.status = status;
        this.message = message;
        this.jobs = jobs;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public List<Job> getJobs() {
        return jobs;
    }

    public void setJobs(List<Job> jobs) {
        this.jobs = jobs;
    }
}

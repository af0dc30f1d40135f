package com.example.schedulerservice.jobs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Job {
    private String name;
    private String cron; // UNIX 5-field cron expression
    private String endpoint;

    public Job() {
    }

    public Job(String name, String cron, String endpoint) {
        this.name = name;
        this.cron = cron;
        this.endpoint = endpoint;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Job)) {
            return false;
        }
        Job other = (Job) o;
        return Objects.equals(name, other.name)
                && Objects.equals(cron, other.cron)
                && Objects.equals(endpoint, other.endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, cron, endpoint);
    }

    @Override
    public String toString() {
        return "Job{name=" + name + ", cron=" + cron + ", endpoint=" + endpoint + "}";
    }
}

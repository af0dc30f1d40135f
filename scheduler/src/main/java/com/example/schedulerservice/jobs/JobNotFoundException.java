package com.example.schedulerservice.jobs;

public class JobNotFoundException extends JobException {
    public JobNotFoundException(String name) {
        super("job_not_found", "job \"" + name + "\" does not exist");
    }
}

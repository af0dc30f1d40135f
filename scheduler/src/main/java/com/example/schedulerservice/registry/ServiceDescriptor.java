package com.example.schedulerservice.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ServiceDescriptor {
    private String name;
    private String url;
    @JsonProperty("health_url")
    private String healthUrl;

    public ServiceDescriptor() {
    }

    public ServiceDescriptor(String name, String url, String healthUrl) {
        this.name = name;
        this.url = url;
        this.healthUrl = healthUrl;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getHealthUrl() {
        return healthUrl;
    }

    public void setHealthUrl(String healthUrl) {
        this.healthUrl = healthUrl;
    }
}

package com.bastion.datasource;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Create/update payload for a data source. Null fields on update keep the
 * current value.
 */
public class DataSourceRequest {
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;
    @Size(max = 2048, message = "URL must be at most 2048 characters")
    private String url;
    private List<String> indicatorTypes;

    /**
     * Seconds between fetches. Defaults to system.defaultFetchInterval on create.
     */
    @Min(value = 60, message = "Fetch interval must be at least 60 seconds")
    private Integer fetchInterval;

    private Boolean isActive;
    private Boolean ignoreCertificateErrors;

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

    public List<String> getIndicatorTypes() {
        return indicatorTypes;
    }

    public void setIndicatorTypes(List<String> indicatorTypes) {
        this.indicatorTypes = indicatorTypes;
    }

    public Integer getFetchInterval() {
        return fetchInterval;
    }

    public void setFetchInterval(Integer fetchInterval) {
        this.fetchInterval = fetchInterval;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
    }

    public Boolean getIgnoreCertificateErrors() {
        return ignoreCertificateErrors;
    }

    public void setIgnoreCertificateErrors(Boolean ignoreCertificateErrors) {
        this.ignoreCertificateErrors = ignoreCertificateErrors;
    }
}

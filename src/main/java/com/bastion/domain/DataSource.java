package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A remote threat feed polled on an interval.
 *
 * Administrative fields (name, url, types, interval, flags) are owned by the
 * data source CRUD endpoints. Runtime fields (lastFetch, lastFetchStatus,
 * lastFetchError) are written only by the ingestion pipeline.
 *
 * Pausing does not clear lastFetch. On resume, resumedAt becomes the new
 * scheduling anchor so that missed intervals are not replayed.
 */
public class DataSource {

    /**
     * Lower bound for fetch intervals, in seconds
     */
    public static final int MIN_FETCH_INTERVAL_SECONDS = 60;

    @JsonProperty("id")
    private Long id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("url")
    private String url;

    @JsonProperty("indicatorTypes")
    private Set<IndicatorType> indicatorTypes;

    /**
     * Fetch interval in seconds
     */
    @JsonProperty("fetchInterval")
    private int fetchInterval;

    @JsonProperty("isActive")
    private boolean active;

    @JsonProperty("isPaused")
    private boolean paused;

    @JsonProperty("ignoreCertificateErrors")
    private boolean ignoreCertificateErrors;

    @JsonProperty("lastFetch")
    private Instant lastFetch;

    @JsonProperty("lastFetchStatus")
    private FetchStatus lastFetchStatus;

    @JsonProperty("lastFetchError")
    private String lastFetchError;

    @JsonProperty("resumedAt")
    private Instant resumedAt;

    @JsonProperty("createdAt")
    private Instant createdAt;

    @JsonProperty("createdBy")
    private Long createdBy;

    public DataSource() {
        this.indicatorTypes = new LinkedHashSet<>();
        this.active = true;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final DataSource source;

        public Builder() {
            this.source = new DataSource();
        }

        public Builder id(Long id) {
            source.id = id;
            return this;
        }

        public Builder name(String name) {
            source.name = name;
            return this;
        }

        public Builder url(String url) {
            source.url = url;
            return this;
        }

        public Builder indicatorTypes(Set<IndicatorType> indicatorTypes) {
            source.indicatorTypes = new LinkedHashSet<>(indicatorTypes);
            return this;
        }

        public Builder indicatorTypes(IndicatorType first, IndicatorType... rest) {
            source.indicatorTypes = new LinkedHashSet<>(EnumSet.of(first, rest));
            return this;
        }

        public Builder fetchInterval(int fetchInterval) {
            source.fetchInterval = fetchInterval;
            return this;
        }

        public Builder active(boolean active) {
            source.active = active;
            return this;
        }

        public Builder paused(boolean paused) {
            source.paused = paused;
            return this;
        }

        public Builder ignoreCertificateErrors(boolean ignoreCertificateErrors) {
            source.ignoreCertificateErrors = ignoreCertificateErrors;
            return this;
        }

        public Builder lastFetch(Instant lastFetch) {
            source.lastFetch = lastFetch;
            return this;
        }

        public Builder lastFetchStatus(FetchStatus lastFetchStatus) {
            source.lastFetchStatus = lastFetchStatus;
            return this;
        }

        public Builder lastFetchError(String lastFetchError) {
            source.lastFetchError = lastFetchError;
            return this;
        }

        public Builder resumedAt(Instant resumedAt) {
            source.resumedAt = resumedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            source.createdAt = createdAt;
            return this;
        }

        public Builder createdBy(Long createdBy) {
            source.createdBy = createdBy;
            return this;
        }

        public DataSource build() {
            return source;
        }
    }

    /**
     * The instant interval scheduling is measured from: the later of the last
     * fetch and the last resume. Null means the source has never been
     * scheduled and is immediately due.
     */
    public Instant schedulingAnchor() {
        if (lastFetch == null) {
            return resumedAt;
        }
        if (resumedAt == null) {
            return lastFetch;
        }
        return lastFetch.isAfter(resumedAt) ? lastFetch : resumedAt;
    }

    public boolean declares(IndicatorType type) {
        return indicatorTypes != null && indicatorTypes.contains(type);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
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

    public Set<IndicatorType> getIndicatorTypes() {
        return indicatorTypes;
    }

    public void setIndicatorTypes(Set<IndicatorType> indicatorTypes) {
        this.indicatorTypes = indicatorTypes;
    }

    public int getFetchInterval() {
        return fetchInterval;
    }

    public void setFetchInterval(int fetchInterval) {
        this.fetchInterval = fetchInterval;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public boolean isIgnoreCertificateErrors() {
        return ignoreCertificateErrors;
    }

    public void setIgnoreCertificateErrors(boolean ignoreCertificateErrors) {
        this.ignoreCertificateErrors = ignoreCertificateErrors;
    }

    public Instant getLastFetch() {
        return lastFetch;
    }

    public void setLastFetch(Instant lastFetch) {
        this.lastFetch = lastFetch;
    }

    public FetchStatus getLastFetchStatus() {
        return lastFetchStatus;
    }

    public void setLastFetchStatus(FetchStatus lastFetchStatus) {
        this.lastFetchStatus = lastFetchStatus;
    }

    public String getLastFetchError() {
        return lastFetchError;
    }

    public void setLastFetchError(String lastFetchError) {
        this.lastFetchError = lastFetchError;
    }

    public Instant getResumedAt() {
        return resumedAt;
    }

    public void setResumedAt(Instant resumedAt) {
        this.resumedAt = resumedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    @Override
    public String toString() {
        return "DataSource{id=" + id + ", name='" + name + "', url='" + url + "', types=" + indicatorTypes
            + ", interval=" + fetchInterval + ", active=" + active + ", paused=" + paused + "}";
    }
}

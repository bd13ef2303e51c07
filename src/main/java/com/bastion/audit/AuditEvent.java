package com.bastion.audit;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audit log entry. userId and ipAddress are null for actions the
 * pipeline performs on its own (scheduled fetches, sweeps, exports).
 */
public class AuditEvent {

    public static final String RESOURCE_DATA_SOURCE = "data_source";
    public static final String RESOURCE_INDICATOR = "indicator";
    public static final String RESOURCE_INDICATOR_NOTE = "indicator_note";
    public static final String RESOURCE_WHITELIST = "whitelist";
    public static final String RESOURCE_BLACKLIST = "blacklist";

    @JsonProperty("id")
    private Long id;

    @JsonProperty("level")
    private AuditLevel level;

    @JsonProperty("action")
    private AuditAction action;

    @JsonProperty("resource")
    private String resource;

    @JsonProperty("resourceId")
    private String resourceId;

    @JsonProperty("details")
    private String details;

    @JsonProperty("userId")
    private Long userId;

    @JsonProperty("ipAddress")
    private String ipAddress;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;

    @JsonProperty("createdAt")
    private Instant createdAt;

    public AuditEvent() {
        this.level = AuditLevel.INFO;
        this.metadata = new LinkedHashMap<>();
    }

    public static Builder builder(AuditAction action, String resource) {
        return new Builder().action(action).resource(resource);
    }

    public static class Builder {
        private final AuditEvent event;

        public Builder() {
            this.event = new AuditEvent();
        }

        public Builder level(AuditLevel level) {
            event.level = level;
            return this;
        }

        public Builder action(AuditAction action) {
            event.action = action;
            return this;
        }

        public Builder resource(String resource) {
            event.resource = resource;
            return this;
        }

        public Builder resourceId(Object resourceId) {
            event.resourceId = resourceId == null ? null : String.valueOf(resourceId);
            return this;
        }

        public Builder details(String details) {
            event.details = details;
            return this;
        }

        public Builder userId(Long userId) {
            event.userId = userId;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            event.ipAddress = ipAddress;
            return this;
        }

        public Builder metadata(String key, Object value) {
            event.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            event.metadata.putAll(metadata);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            event.createdAt = createdAt;
            return this;
        }

        public AuditEvent build() {
            if (event.action == null) {
                throw new IllegalStateException("Audit action must be set");
            }
            if (event.resource == null) {
                throw new IllegalStateException("Audit resource must be set");
            }
            return event;
        }
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public AuditLevel getLevel() {
        return level;
    }

    public void setLevel(AuditLevel level) {
        this.level = level;
    }

    public AuditAction getAction() {
        return action;
    }

    public void setAction(AuditAction action) {
        this.action = action;
    }

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
    }

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public void setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "AuditEvent{level=" + level + ", action=" + action + ", resource='" + resource
            + "', resourceId='" + resourceId + "', details='" + details + "'}";
    }
}

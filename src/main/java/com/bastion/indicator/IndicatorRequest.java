package com.bastion.indicator;

import jakarta.validation.constraints.Size;

/**
 * Create/update payload for an indicator. On update only isActive and notes
 * are applied; value and type are immutable.
 */
public class IndicatorRequest {
    @Size(max = 2048, message = "Value must be at most 2048 characters")
    private String value;
    private String type;
    private Boolean isActive;
    private String notes;

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}

package com.bastion.indicator;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public class TempActivationRequest {
    @NotNull(message = "durationHours is required")
    @Min(value = 1, message = "Duration must be between 1 and 168 hours")
    @Max(value = 168, message = "Duration must be between 1 and 168 hours")
    private Integer durationHours;

    public Integer getDurationHours() {
        return durationHours;
    }

    public void setDurationHours(Integer durationHours) {
        this.durationHours = durationHours;
    }
}

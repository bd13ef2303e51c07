package com.bastion.whitelist;

import jakarta.validation.constraints.NotBlank;

/**
 * Payload for whitelist create and check. For a check the type may be
 * omitted and is then detected from the value.
 */
public class WhitelistRequest {
    @NotBlank(message = "Value is required")
    private String value;
    private String type;
    private String reason;

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

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}

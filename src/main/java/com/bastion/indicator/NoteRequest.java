package com.bastion.indicator;

import jakarta.validation.constraints.NotBlank;

public class NoteRequest {
    @NotBlank(message = "Note content must not be empty")
    private String content;

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }
}

package com.noteshub.gamification.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ShareRequest {
    @NotBlank
    private String noteId;
    // whatsapp, instagram, twitter, facebook, ...
    @NotBlank
    private String platform;
}

package com.example.notificationjobs.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

public record NotificationActionRequest(
    @NotBlank @Size(max = 64) String action,
    @NotBlank @Size(max = 64) String title,
    @URL @Size(max = 2048) String icon) {}

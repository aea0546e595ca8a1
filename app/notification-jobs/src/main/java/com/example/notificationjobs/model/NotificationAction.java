package com.example.notificationjobs.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationAction(String action, String title, String icon) {}

package com.flock.server.api.request;

import jakarta.validation.constraints.NotNull;

public record NotificationToggleRequest(@NotNull(message = "enabled is required") Boolean enabled) {}

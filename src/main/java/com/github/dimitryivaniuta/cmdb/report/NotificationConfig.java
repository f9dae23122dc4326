package com.github.dimitryivaniuta.cmdb.report;

import jakarta.validation.constraints.Email;

import java.util.List;

public record NotificationConfig(
        boolean enabled,
        List<@Email String> recipients,
        boolean onSuccess,
        boolean onFailure
) {
}

package com.github.dimitryivaniuta.cmdb.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.cmdb.resource.OnCreate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * Create and update payload for report definitions. On update every member is optional and only
 * non-null members are applied.
 */
@Getter
@Setter
public class ReportDefinitionRequest {

    @Pattern(regexp = "^[A-Za-z0-9][A-Za-z0-9_.-]{0,254}$", message = "reportId may contain letters, digits, '_', '.' and '-'")
    private String reportId;

    @NotBlank(groups = OnCreate.class, message = "name is required")
    @Size(max = 255)
    private String name;

    private String description;

    @NotNull(groups = OnCreate.class, message = "reportType is required")
    private ReportType reportType;

    @NotNull(groups = OnCreate.class, message = "category is required")
    private ReportCategory category;

    private CloudProvider provider;

    @Valid
    @NotNull(groups = OnCreate.class, message = "queryConfig is required")
    private QueryConfig queryConfig;

    @Valid
    private ScheduleConfig schedulingConfig;

    @Valid
    private NotificationConfig notificationConfig;

    @JsonProperty("isActive")
    private Boolean active;

    @JsonProperty("isPublic")
    private Boolean publicReport;
}

package com.github.dimitryivaniuta.cmdb.resource;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

/**
 * Fields accepted for every resource type. Null means "not provided": on create the entity default
 * applies, on update the stored value is kept.
 */
@Getter
@Setter
public abstract class ResourceRequest {

    @NotBlank(groups = OnCreate.class, message = "region is required")
    @Pattern(regexp = "^[a-z]{2}(-[a-z]+)+-\\d+$", message = "region must look like us-east-1")
    private String region;

    @Pattern(regexp = "^\\d{12}$", message = "awsAccountId must be 12 digits")
    private String awsAccountId;

    @Size(max = 255)
    private String name;

    @Size(max = 2000)
    private String description;

    private Map<String, String> tags;

    @Size(max = 50)
    private String environment;

    @Size(max = 100)
    private String project;

    @Size(max = 100)
    private String costCenter;

    @Size(max = 255)
    private String owner;

    @Size(max = 50)
    private String sourceSystem;

    /** Provider-assigned identifier of the resource, or null when not part of the request. */
    public abstract String externalId();

    public abstract String state();
}

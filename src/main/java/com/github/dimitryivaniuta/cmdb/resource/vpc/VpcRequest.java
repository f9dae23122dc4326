package com.github.dimitryivaniuta.cmdb.resource.vpc;

import com.github.dimitryivaniuta.cmdb.resource.OnCreate;
import com.github.dimitryivaniuta.cmdb.resource.ResourceRequest;
import com.github.dimitryivaniuta.cmdb.support.NetworkAddressSupport;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class VpcRequest extends ResourceRequest {

    @NotBlank(groups = OnCreate.class, message = "vpcId is required")
    @Pattern(regexp = "^vpc-[0-9a-f]{8}([0-9a-f]{9})?$", message = "vpcId must match vpc-xxxxxxxx or vpc-xxxxxxxxxxxxxxxxx")
    private String vpcId;

    @NotBlank(groups = OnCreate.class, message = "cidrBlock is required")
    @Pattern(regexp = NetworkAddressSupport.CIDR_PATTERN, message = "cidrBlock must be a valid IPv4 CIDR block")
    private String cidrBlock;

    @Pattern(regexp = "^(pending|available|deleting|deleted|failed)$",
            message = "state must be one of pending, available, deleting, deleted, failed")
    private String state;

    @Pattern(regexp = "^(default|dedicated|host)$", message = "instanceTenancy must be one of default, dedicated, host")
    private String instanceTenancy;

    private Boolean enableDnsHostnames;
    private Boolean enableDnsSupport;
    private Boolean isDefault;

    @Override
    public String externalId() {
        return vpcId;
    }

    @Override
    public String state() {
        return state;
    }
}

package com.github.dimitryivaniuta.cmdb.resource.endpoint;

import com.github.dimitryivaniuta.cmdb.resource.OnCreate;
import com.github.dimitryivaniuta.cmdb.resource.ResourceRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class VpcEndpointRequest extends ResourceRequest {

    @NotBlank(groups = OnCreate.class, message = "vpcEndpointId is required")
    @Pattern(regexp = "^vpce-[0-9a-f]{8}([0-9a-f]{9})?$", message = "vpcEndpointId must match vpce-xxxxxxxxxxxxxxxxx")
    private String vpcEndpointId;

    @NotBlank(groups = OnCreate.class, message = "vpcId is required")
    @Pattern(regexp = "^vpc-[0-9a-f]{8}([0-9a-f]{9})?$", message = "vpcId must match vpc-xxxxxxxxxxxxxxxxx")
    private String vpcId;

    @NotBlank(groups = OnCreate.class, message = "serviceName is required")
    @Size(max = 255)
    private String serviceName;

    @NotBlank(groups = OnCreate.class, message = "vpcEndpointType is required")
    @Pattern(regexp = "^(Interface|Gateway|GatewayLoadBalancer)$",
            message = "vpcEndpointType must be one of Interface, Gateway, GatewayLoadBalancer")
    private String vpcEndpointType;

    @Pattern(regexp = "^(pending|available|deleting|deleted|rejected|failed)$",
            message = "state must be one of pending, available, deleting, deleted, rejected, failed")
    private String state;

    private List<@Pattern(regexp = "^subnet-[0-9a-f]{8,17}$", message = "invalid subnet id") String> subnetIds;
    private List<@Pattern(regexp = "^rtb-[0-9a-f]{8,17}$", message = "invalid route table id") String> routeTableIds;
    private List<@Pattern(regexp = "^sg-[0-9a-f]{8,17}$", message = "invalid security group id") String> securityGroupIds;

    private Boolean privateDnsEnabled;

    @Size(max = 20480)
    private String policyDocument;

    @Override
    public String externalId() {
        return vpcEndpointId;
    }

    @Override
    public String state() {
        return state;
    }
}

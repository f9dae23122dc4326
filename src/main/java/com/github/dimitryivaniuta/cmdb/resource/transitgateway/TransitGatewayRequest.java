package com.github.dimitryivaniuta.cmdb.resource.transitgateway;

import com.github.dimitryivaniuta.cmdb.resource.OnCreate;
import com.github.dimitryivaniuta.cmdb.resource.ResourceRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class TransitGatewayRequest extends ResourceRequest {

    private static final String ENABLE_DISABLE = "^(enable|disable)$";

    @NotBlank(groups = OnCreate.class, message = "transitGatewayId is required")
    @Pattern(regexp = "^tgw-[0-9a-f]{8}([0-9a-f]{9})?$", message = "transitGatewayId must match tgw-xxxxxxxxxxxxxxxxx")
    private String transitGatewayId;

    @Pattern(regexp = "^(pending|available|modifying|deleting|deleted|failed)$",
            message = "state must be one of pending, available, modifying, deleting, deleted, failed")
    private String state;

    @Min(1)
    @Max(4294967294L)
    private Long amazonSideAsn;

    @Pattern(regexp = ENABLE_DISABLE, message = "must be enable or disable")
    private String autoAcceptSharedAttachments;

    @Pattern(regexp = ENABLE_DISABLE, message = "must be enable or disable")
    private String defaultRouteTableAssociation;

    @Pattern(regexp = ENABLE_DISABLE, message = "must be enable or disable")
    private String defaultRouteTablePropagation;

    @Pattern(regexp = ENABLE_DISABLE, message = "must be enable or disable")
    private String dnsSupport;

    @Pattern(regexp = ENABLE_DISABLE, message = "must be enable or disable")
    private String vpnEcmpSupport;

    private List<String> transitGatewayCidrBlocks;

    @Override
    public String externalId() {
        return transitGatewayId;
    }

    @Override
    public String state() {
        return state;
    }
}

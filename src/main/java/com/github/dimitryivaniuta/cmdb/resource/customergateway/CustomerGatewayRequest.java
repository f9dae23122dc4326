package com.github.dimitryivaniuta.cmdb.resource.customergateway;

import com.github.dimitryivaniuta.cmdb.resource.OnCreate;
import com.github.dimitryivaniuta.cmdb.resource.ResourceRequest;
import com.github.dimitryivaniuta.cmdb.support.NetworkAddressSupport;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class CustomerGatewayRequest extends ResourceRequest {

    @NotBlank(groups = OnCreate.class, message = "customerGatewayId is required")
    @Pattern(regexp = "^cgw-[0-9a-f]{8}([0-9a-f]{9})?$", message = "customerGatewayId must match cgw-xxxxxxxxxxxxxxxxx")
    private String customerGatewayId;

    @Pattern(regexp = "^(pending|available|deleting|deleted|failed)$",
            message = "state must be one of pending, available, deleting, deleted, failed")
    private String state;

    @Pattern(regexp = "^ipsec\\.1$", message = "type must be ipsec.1")
    private String type;

    @NotBlank(groups = OnCreate.class, message = "ipAddress is required")
    @Pattern(regexp = NetworkAddressSupport.IPV4_PATTERN, message = "ipAddress must be a valid IPv4 address")
    private String ipAddress;

    @NotNull(groups = OnCreate.class, message = "bgpAsn is required")
    @Min(1)
    @Max(4294967294L)
    private Long bgpAsn;

    @Size(max = 255)
    private String deviceName;

    @Pattern(regexp = "^arn:aws[a-z-]*:acm:.+$", message = "certificateArn must be an ACM certificate ARN")
    private String certificateArn;

    @Override
    public String externalId() {
        return customerGatewayId;
    }

    @Override
    public String state() {
        return state;
    }
}

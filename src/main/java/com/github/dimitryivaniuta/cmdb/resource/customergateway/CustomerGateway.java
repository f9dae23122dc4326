package com.github.dimitryivaniuta.cmdb.resource.customergateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "customer_gateway")
@AttributeOverride(name = "externalId", column = @Column(name = "customer_gateway_id", nullable = false, length = 64))
public class CustomerGateway extends NetworkResourceEntity {

    @Column(name = "gateway_type", nullable = false, length = 16)
    private String type;

    @Column(name = "ip_address", nullable = false, length = 15)
    private String ipAddress;

    @Column(name = "bgp_asn", nullable = false)
    private Long bgpAsn;

    @Column(name = "device_name", length = 255)
    private String deviceName;

    @Column(name = "certificate_arn", length = 2048)
    private String certificateArn;

    @JsonProperty("customerGatewayId")
    public String getCustomerGatewayId() {
        return getExternalId();
    }
}

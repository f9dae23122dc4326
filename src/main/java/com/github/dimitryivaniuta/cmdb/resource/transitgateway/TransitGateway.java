package com.github.dimitryivaniuta.cmdb.resource.transitgateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "transit_gateway")
@AttributeOverride(name = "externalId", column = @Column(name = "transit_gateway_id", nullable = false, length = 64))
public class TransitGateway extends NetworkResourceEntity {

    @Column(name = "amazon_side_asn", nullable = false)
    private Long amazonSideAsn;

    // enable / disable, mirrors the provider's option vocabulary
    @Column(name = "auto_accept_shared_attachments", nullable = false, length = 8)
    private String autoAcceptSharedAttachments;

    @Column(name = "default_route_table_association", nullable = false, length = 8)
    private String defaultRouteTableAssociation;

    @Column(name = "default_route_table_propagation", nullable = false, length = 8)
    private String defaultRouteTablePropagation;

    @Column(name = "dns_support", nullable = false, length = 8)
    private String dnsSupport;

    @Column(name = "vpn_ecmp_support", nullable = false, length = 8)
    private String vpnEcmpSupport;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "transit_gateway_cidr_blocks", columnDefinition = "jsonb")
    private List<String> transitGatewayCidrBlocks;

    @JsonProperty("transitGatewayId")
    public String getTransitGatewayId() {
        return getExternalId();
    }
}

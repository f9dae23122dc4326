package com.github.dimitryivaniuta.cmdb.resource.endpoint;

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
@Table(name = "vpc_endpoint")
@AttributeOverride(name = "externalId", column = @Column(name = "vpc_endpoint_id", nullable = false, length = 64))
public class VpcEndpoint extends NetworkResourceEntity {

    @Column(name = "vpc_id", nullable = false, length = 64)
    private String vpcId;

    @Column(name = "service_name", nullable = false, length = 255)
    private String serviceName;

    @Column(name = "vpc_endpoint_type", nullable = false, length = 32)
    private String vpcEndpointType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "subnet_ids", columnDefinition = "jsonb")
    private List<String> subnetIds;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "route_table_ids", columnDefinition = "jsonb")
    private List<String> routeTableIds;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "security_group_ids", columnDefinition = "jsonb")
    private List<String> securityGroupIds;

    @Column(name = "private_dns_enabled", nullable = false)
    private boolean privateDnsEnabled;

    @Column(name = "policy_document", columnDefinition = "text")
    private String policyDocument;

    @JsonProperty("vpcEndpointId")
    public String getVpcEndpointId() {
        return getExternalId();
    }
}

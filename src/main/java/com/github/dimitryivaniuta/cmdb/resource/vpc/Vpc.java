package com.github.dimitryivaniuta.cmdb.resource.vpc;

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
@Table(name = "vpc")
@AttributeOverride(name = "externalId", column = @Column(name = "vpc_id", nullable = false, length = 64))
public class Vpc extends NetworkResourceEntity {

    @Column(name = "cidr_block", nullable = false, length = 18)
    private String cidrBlock;

    @Column(name = "instance_tenancy", nullable = false, length = 16)
    private String instanceTenancy;

    @Column(name = "enable_dns_hostnames", nullable = false)
    private boolean enableDnsHostnames;

    @Column(name = "enable_dns_support", nullable = false)
    private boolean enableDnsSupport;

    @JsonProperty("isDefault")
    @Column(name = "is_default", nullable = false)
    private boolean defaultVpc;

    @JsonProperty("vpcId")
    public String getVpcId() {
        return getExternalId();
    }
}

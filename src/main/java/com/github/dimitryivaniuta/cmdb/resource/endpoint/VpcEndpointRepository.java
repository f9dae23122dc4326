package com.github.dimitryivaniuta.cmdb.resource.endpoint;

import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceRepository;

import java.util.List;

public interface VpcEndpointRepository extends NetworkResourceRepository<VpcEndpoint> {

    List<VpcEndpoint> findByVpcIdAndRegionAndDeletedAtIsNull(String vpcId, String region);
}

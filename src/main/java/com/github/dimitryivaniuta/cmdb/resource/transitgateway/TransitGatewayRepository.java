package com.github.dimitryivaniuta.cmdb.resource.transitgateway;

import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceRepository;

public interface TransitGatewayRepository extends NetworkResourceRepository<TransitGateway> {
}

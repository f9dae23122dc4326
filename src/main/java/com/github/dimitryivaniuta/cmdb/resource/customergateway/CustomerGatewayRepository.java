package com.github.dimitryivaniuta.cmdb.resource.customergateway;

import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceRepository;

public interface CustomerGatewayRepository extends NetworkResourceRepository<CustomerGateway> {
}

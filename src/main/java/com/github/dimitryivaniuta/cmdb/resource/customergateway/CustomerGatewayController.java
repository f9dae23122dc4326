package com.github.dimitryivaniuta.cmdb.resource.customergateway;

import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceController;
import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/customer-gateways")
public class CustomerGatewayController extends AbstractResourceController<CustomerGateway, CustomerGatewayRequest> {

    private final CustomerGatewayService service;

    @Override
    protected AbstractResourceService<CustomerGateway, CustomerGatewayRequest> service() {
        return service;
    }
}

package com.github.dimitryivaniuta.cmdb.resource.transitgateway;

import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceController;
import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/transit-gateways")
public class TransitGatewayController extends AbstractResourceController<TransitGateway, TransitGatewayRequest> {

    private final TransitGatewayService service;

    @Override
    protected AbstractResourceService<TransitGateway, TransitGatewayRequest> service() {
        return service;
    }
}

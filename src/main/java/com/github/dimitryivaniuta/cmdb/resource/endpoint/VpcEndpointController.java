package com.github.dimitryivaniuta.cmdb.resource.endpoint;

import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceController;
import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/vpc-endpoints")
public class VpcEndpointController extends AbstractResourceController<VpcEndpoint, VpcEndpointRequest> {

    private final VpcEndpointService service;

    @Override
    protected AbstractResourceService<VpcEndpoint, VpcEndpointRequest> service() {
        return service;
    }
}

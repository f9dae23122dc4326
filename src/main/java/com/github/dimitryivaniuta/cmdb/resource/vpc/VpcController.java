package com.github.dimitryivaniuta.cmdb.resource.vpc;

import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceController;
import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/vpcs")
public class VpcController extends AbstractResourceController<Vpc, VpcRequest> {

    private final VpcService service;

    @Override
    protected AbstractResourceService<Vpc, VpcRequest> service() {
        return service;
    }
}

package com.github.dimitryivaniuta.cmdb.resource.vpc;

import com.github.dimitryivaniuta.cmdb.error.BusinessRuleException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceService;
import com.github.dimitryivaniuta.cmdb.resource.ResourceServiceSupport;
import com.github.dimitryivaniuta.cmdb.resource.ResourceType;
import com.github.dimitryivaniuta.cmdb.support.NetworkAddressSupport;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Service
public class VpcService extends AbstractResourceService<Vpc, VpcRequest> {

    private static final Set<String> NON_CREATABLE_STATES = Set.of("deleting", "deleted");

    public VpcService(VpcRepository repository, ResourceServiceSupport support) {
        super(repository, support);
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.VPC;
    }

    @Override
    public Class<VpcRequest> requestType() {
        return VpcRequest.class;
    }

    @Override
    protected String externalIdField() {
        return "vpcId";
    }

    @Override
    protected Vpc newEntity() {
        Vpc vpc = new Vpc();
        vpc.setEnableDnsSupport(true);
        return vpc;
    }

    @Override
    protected void applySpecific(VpcRequest request, Vpc vpc) {
        if (request.getCidrBlock() != null) vpc.setCidrBlock(request.getCidrBlock());
        if (request.getInstanceTenancy() != null) vpc.setInstanceTenancy(request.getInstanceTenancy());
        if (request.getEnableDnsHostnames() != null) vpc.setEnableDnsHostnames(request.getEnableDnsHostnames());
        if (request.getEnableDnsSupport() != null) vpc.setEnableDnsSupport(request.getEnableDnsSupport());
        if (request.getIsDefault() != null) vpc.setDefaultVpc(request.getIsDefault());
    }

    @Override
    protected void applyDefaults(Vpc vpc) {
        if (vpc.getState() == null) vpc.setState("pending");
        if (vpc.getInstanceTenancy() == null) vpc.setInstanceTenancy("default");
    }

    @Override
    protected List<ErrorDetail> businessRuleViolations(Vpc vpc) {
        List<ErrorDetail> errors = new ArrayList<>();

        int prefix = NetworkAddressSupport.prefixLength(vpc.getCidrBlock());
        if (prefix < 16 || prefix > 28) {
            errors.add(new ErrorDetail(BusinessRuleException.CODE,
                    "VPC CIDR block must be between /16 and /28, got /" + prefix, "cidrBlock"));
        }
        if (vpc.getId() == null && NON_CREATABLE_STATES.contains(vpc.getState())) {
            errors.add(new ErrorDetail(BusinessRuleException.CODE,
                    "A VPC cannot be registered in state " + vpc.getState(), "state"));
        }
        if (vpc.isEnableDnsHostnames() && !vpc.isEnableDnsSupport()) {
            errors.add(new ErrorDetail(BusinessRuleException.CODE,
                    "enableDnsHostnames requires enableDnsSupport", "enableDnsHostnames"));
        }
        return errors;
    }
}

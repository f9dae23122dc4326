package com.github.dimitryivaniuta.cmdb.resource.endpoint;

import com.github.dimitryivaniuta.cmdb.error.BusinessRuleException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceService;
import com.github.dimitryivaniuta.cmdb.resource.ResourceServiceSupport;
import com.github.dimitryivaniuta.cmdb.resource.ResourceType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

@Service
public class VpcEndpointService extends AbstractResourceService<VpcEndpoint, VpcEndpointRequest> {

    private static final Pattern GATEWAY_SERVICES = Pattern.compile("^com\\.amazonaws\\.[a-z0-9-]+\\.(s3|dynamodb)$");

    public VpcEndpointService(VpcEndpointRepository repository, ResourceServiceSupport support) {
        super(repository, support);
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.VPC_ENDPOINT;
    }

    @Override
    public Class<VpcEndpointRequest> requestType() {
        return VpcEndpointRequest.class;
    }

    @Override
    protected String externalIdField() {
        return "vpcEndpointId";
    }

    @Override
    protected VpcEndpoint newEntity() {
        return new VpcEndpoint();
    }

    @Override
    protected void applySpecific(VpcEndpointRequest r, VpcEndpoint e) {
        if (r.getVpcId() != null) e.setVpcId(r.getVpcId());
        if (r.getServiceName() != null) e.setServiceName(r.getServiceName());
        if (r.getVpcEndpointType() != null) e.setVpcEndpointType(r.getVpcEndpointType());
        if (r.getSubnetIds() != null) e.setSubnetIds(r.getSubnetIds());
        if (r.getRouteTableIds() != null) e.setRouteTableIds(r.getRouteTableIds());
        if (r.getSecurityGroupIds() != null) e.setSecurityGroupIds(r.getSecurityGroupIds());
        if (r.getPrivateDnsEnabled() != null) e.setPrivateDnsEnabled(r.getPrivateDnsEnabled());
        if (r.getPolicyDocument() != null) e.setPolicyDocument(r.getPolicyDocument());
    }

    @Override
    protected void applyDefaults(VpcEndpoint e) {
        if (e.getState() == null) e.setState("pending");
    }

    @Override
    protected List<ErrorDetail> businessRuleViolations(VpcEndpoint e) {
        List<ErrorDetail> errors = new ArrayList<>();
        String type = e.getVpcEndpointType();

        if ("Gateway".equals(type)) {
            if (!GATEWAY_SERVICES.matcher(e.getServiceName()).matches()) {
                errors.add(violation("Gateway endpoints are only available for S3 and DynamoDB", "serviceName"));
            }
            if (isEmpty(e.getRouteTableIds())) {
                errors.add(violation("Gateway endpoints require at least one route table", "routeTableIds"));
            }
            if (!isEmpty(e.getSubnetIds())) {
                errors.add(violation("Gateway endpoints do not attach to subnets", "subnetIds"));
            }
        } else if ("Interface".equals(type) || "GatewayLoadBalancer".equals(type)) {
            if (isEmpty(e.getSubnetIds())) {
                errors.add(violation(type + " endpoints require at least one subnet", "subnetIds"));
            }
        }

        if (e.isPrivateDnsEnabled() && !"Interface".equals(type)) {
            errors.add(violation("privateDnsEnabled is only supported for Interface endpoints", "privateDnsEnabled"));
        }
        return errors;
    }

    private static ErrorDetail violation(String message, String field) {
        return new ErrorDetail(BusinessRuleException.CODE, message, field);
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}

package com.github.dimitryivaniuta.cmdb.resource.customergateway;

import com.github.dimitryivaniuta.cmdb.error.BusinessRuleException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceService;
import com.github.dimitryivaniuta.cmdb.resource.ResourceServiceSupport;
import com.github.dimitryivaniuta.cmdb.resource.ResourceType;
import com.github.dimitryivaniuta.cmdb.support.NetworkAddressSupport;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class CustomerGatewayService extends AbstractResourceService<CustomerGateway, CustomerGatewayRequest> {

    public CustomerGatewayService(CustomerGatewayRepository repository, ResourceServiceSupport support) {
        super(repository, support);
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.CUSTOMER_GATEWAY;
    }

    @Override
    public Class<CustomerGatewayRequest> requestType() {
        return CustomerGatewayRequest.class;
    }

    @Override
    protected String externalIdField() {
        return "customerGatewayId";
    }

    @Override
    protected CustomerGateway newEntity() {
        return new CustomerGateway();
    }

    @Override
    protected void applySpecific(CustomerGatewayRequest r, CustomerGateway cgw) {
        if (r.getType() != null) cgw.setType(r.getType());
        if (r.getIpAddress() != null) cgw.setIpAddress(r.getIpAddress());
        if (r.getBgpAsn() != null) cgw.setBgpAsn(r.getBgpAsn());
        if (r.getDeviceName() != null) cgw.setDeviceName(r.getDeviceName());
        if (r.getCertificateArn() != null) cgw.setCertificateArn(r.getCertificateArn());
    }

    @Override
    protected void applyDefaults(CustomerGateway cgw) {
        if (cgw.getState() == null) cgw.setState("pending");
        if (cgw.getType() == null) cgw.setType("ipsec.1");
    }

    @Override
    protected List<ErrorDetail> businessRuleViolations(CustomerGateway cgw) {
        List<ErrorDetail> errors = new ArrayList<>();
        if (NetworkAddressSupport.isNonPublic(cgw.getIpAddress())) {
            errors.add(new ErrorDetail(BusinessRuleException.CODE,
                    "Customer gateway ipAddress must be publicly routable, got " + cgw.getIpAddress(), "ipAddress"));
        }
        return errors;
    }
}

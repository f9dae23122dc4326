package com.github.dimitryivaniuta.cmdb.resource.transitgateway;

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
public class TransitGatewayService extends AbstractResourceService<TransitGateway, TransitGatewayRequest> {

    static final long DEFAULT_AMAZON_SIDE_ASN = 64512L;

    public TransitGatewayService(TransitGatewayRepository repository, ResourceServiceSupport support) {
        super(repository, support);
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.TRANSIT_GATEWAY;
    }

    @Override
    public Class<TransitGatewayRequest> requestType() {
        return TransitGatewayRequest.class;
    }

    @Override
    protected String externalIdField() {
        return "transitGatewayId";
    }

    @Override
    protected TransitGateway newEntity() {
        return new TransitGateway();
    }

    @Override
    protected void applySpecific(TransitGatewayRequest r, TransitGateway tgw) {
        if (r.getAmazonSideAsn() != null) tgw.setAmazonSideAsn(r.getAmazonSideAsn());
        if (r.getAutoAcceptSharedAttachments() != null) tgw.setAutoAcceptSharedAttachments(r.getAutoAcceptSharedAttachments());
        if (r.getDefaultRouteTableAssociation() != null) tgw.setDefaultRouteTableAssociation(r.getDefaultRouteTableAssociation());
        if (r.getDefaultRouteTablePropagation() != null) tgw.setDefaultRouteTablePropagation(r.getDefaultRouteTablePropagation());
        if (r.getDnsSupport() != null) tgw.setDnsSupport(r.getDnsSupport());
        if (r.getVpnEcmpSupport() != null) tgw.setVpnEcmpSupport(r.getVpnEcmpSupport());
        if (r.getTransitGatewayCidrBlocks() != null) tgw.setTransitGatewayCidrBlocks(r.getTransitGatewayCidrBlocks());
    }

    @Override
    protected void applyDefaults(TransitGateway tgw) {
        if (tgw.getState() == null) tgw.setState("pending");
        if (tgw.getAmazonSideAsn() == null) tgw.setAmazonSideAsn(DEFAULT_AMAZON_SIDE_ASN);
        if (tgw.getAutoAcceptSharedAttachments() == null) tgw.setAutoAcceptSharedAttachments("disable");
        if (tgw.getDefaultRouteTableAssociation() == null) tgw.setDefaultRouteTableAssociation("enable");
        if (tgw.getDefaultRouteTablePropagation() == null) tgw.setDefaultRouteTablePropagation("enable");
        if (tgw.getDnsSupport() == null) tgw.setDnsSupport("enable");
        if (tgw.getVpnEcmpSupport() == null) tgw.setVpnEcmpSupport("enable");
    }

    @Override
    protected List<ErrorDetail> businessRuleViolations(TransitGateway tgw) {
        List<ErrorDetail> errors = new ArrayList<>();

        long asn = tgw.getAmazonSideAsn();
        boolean privateAsn = (asn >= 64512 && asn <= 65534) || (asn >= 4200000000L && asn <= 4294967294L);
        if (!privateAsn) {
            errors.add(new ErrorDetail(BusinessRuleException.CODE,
                    "amazonSideAsn must be a private ASN (64512-65534 or 4200000000-4294967294)", "amazonSideAsn"));
        }

        List<String> cidrs = tgw.getTransitGatewayCidrBlocks();
        if (cidrs != null) {
            for (int i = 0; i < cidrs.size(); i++) {
                if (!NetworkAddressSupport.isCidr(cidrs.get(i))) {
                    errors.add(new ErrorDetail(BusinessRuleException.CODE,
                            "Invalid CIDR block: " + cidrs.get(i), "transitGatewayCidrBlocks[" + i + "]"));
                }
            }
        }
        return errors;
    }
}

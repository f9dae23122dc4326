package com.github.dimitryivaniuta.cmdb.resource.endpoint;

import com.github.dimitryivaniuta.cmdb.audit.AuditTrail;
import com.github.dimitryivaniuta.cmdb.error.BusinessRuleException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.resource.ResourceServiceSupport;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VpcEndpointServiceTest {

    private static ValidatorFactory validatorFactory;

    private VpcEndpointService service;

    @BeforeAll
    static void initValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        VpcEndpointRepository repository = mock(VpcEndpointRepository.class);
        service = new VpcEndpointService(repository, new ResourceServiceSupport(validatorFactory.getValidator(),
                mock(AuditTrail.class), mock(ApplicationEventPublisher.class),
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC)));
        when(repository.findByExternalIdAndRegionAndDeletedAtIsNull(any(), any())).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(VpcEndpoint.class))).thenAnswer(inv -> {
            VpcEndpoint e = inv.getArgument(0);
            e.setId(12L);
            return e;
        });
    }

    @Test
    void gatewayEndpointForS3WithRouteTables() {
        VpcEndpointRequest r = request("Gateway", "com.amazonaws.us-east-1.s3");
        r.setRouteTableIds(List.of("rtb-0a1b2c3d"));

        VpcEndpoint created = service.create(r, "alice");

        assertThat(created.getVpcEndpointType()).isEqualTo("Gateway");
        assertThat(created.getState()).isEqualTo("pending");
    }

    @Test
    void gatewayEndpointRejectsOtherServicesSubnetsAndMissingRouteTables() {
        VpcEndpointRequest r = request("Gateway", "com.amazonaws.us-east-1.ec2");
        r.setSubnetIds(List.of("subnet-0a1b2c3d"));

        assertThatThrownBy(() -> service.create(r, "alice"))
                .isInstanceOfSatisfying(BusinessRuleException.class, ex -> assertThat(ex.getErrors())
                        .extracting(ErrorDetail::field)
                        .containsExactlyInAnyOrder("serviceName", "routeTableIds", "subnetIds"));
    }

    @Test
    void interfaceEndpointNeedsASubnet() {
        VpcEndpointRequest r = request("Interface", "com.amazonaws.us-east-1.ec2");

        assertThatThrownBy(() -> service.create(r, "alice"))
                .isInstanceOfSatisfying(BusinessRuleException.class, ex -> assertThat(ex.getErrors())
                        .extracting(ErrorDetail::field)
                        .containsExactly("subnetIds"));

        r.setSubnetIds(List.of("subnet-0a1b2c3d"));
        r.setPrivateDnsEnabled(true);
        assertThat(service.create(r, "alice").isPrivateDnsEnabled()).isTrue();
    }

    @Test
    void privateDnsOnlyForInterfaceEndpoints() {
        VpcEndpointRequest r = request("GatewayLoadBalancer", "com.amazonaws.vpce.us-east-1.vpce-svc-0a1b2c3d");
        r.setSubnetIds(List.of("subnet-0a1b2c3d"));
        r.setPrivateDnsEnabled(true);

        assertThatThrownBy(() -> service.create(r, "alice"))
                .isInstanceOfSatisfying(BusinessRuleException.class, ex -> assertThat(ex.getErrors())
                        .extracting(ErrorDetail::field)
                        .containsExactly("privateDnsEnabled"));
    }

    private static VpcEndpointRequest request(String type, String serviceName) {
        VpcEndpointRequest r = new VpcEndpointRequest();
        r.setVpcEndpointId("vpce-0a1b2c3d");
        r.setVpcId("vpc-0a1b2c3d");
        r.setRegion("us-east-1");
        r.setVpcEndpointType(type);
        r.setServiceName(serviceName);
        return r;
    }
}

package com.github.dimitryivaniuta.cmdb.resource.customergateway;

import com.github.dimitryivaniuta.cmdb.audit.AuditTrail;
import com.github.dimitryivaniuta.cmdb.error.BusinessRuleException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.resource.ResourceServiceSupport;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CustomerGatewayServiceTest {

    private static ValidatorFactory validatorFactory;

    private CustomerGatewayRepository repository;
    private CustomerGatewayService service;

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
        repository = mock(CustomerGatewayRepository.class);
        service = new CustomerGatewayService(repository, new ResourceServiceSupport(validatorFactory.getValidator(),
                mock(AuditTrail.class), mock(ApplicationEventPublisher.class),
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC)));
        when(repository.findByExternalIdAndRegionAndDeletedAtIsNull(any(), any())).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(CustomerGateway.class))).thenAnswer(inv -> {
            CustomerGateway cgw = inv.getArgument(0);
            cgw.setId(4L);
            return cgw;
        });
    }

    @Test
    void publicAddressIsAcceptedWithIpsecDefault() {
        CustomerGateway created = service.create(request("203.0.113.12"), "alice");

        assertThat(created.getIpAddress()).isEqualTo("203.0.113.12");
        assertThat(created.getType()).isEqualTo("ipsec.1");
        assertThat(created.getBgpAsn()).isEqualTo(65000L);
    }

    @ParameterizedTest
    @ValueSource(strings = {"10.1.2.3", "172.16.0.1", "192.168.1.1", "127.0.0.1", "169.254.10.10", "100.64.0.1", "224.0.0.5"})
    void nonPublicAddressIsABusinessRuleViolation(String ip) {
        assertThatThrownBy(() -> service.create(request(ip), "alice"))
                .isInstanceOfSatisfying(BusinessRuleException.class, ex -> assertThat(ex.getErrors())
                        .extracting(ErrorDetail::field)
                        .containsExactly("ipAddress"));
    }

    @Test
    void malformedAddressFailsValidationFirst() {
        assertThatThrownBy(() -> service.create(request("300.1.1.1"), "alice"))
                .isInstanceOfSatisfying(ValidationFailedException.class, ex -> assertThat(ex.getErrors())
                        .extracting(ErrorDetail::field)
                        .contains("ipAddress"));
    }

    private static CustomerGatewayRequest request(String ip) {
        CustomerGatewayRequest r = new CustomerGatewayRequest();
        r.setCustomerGatewayId("cgw-0a1b2c3d");
        r.setRegion("us-east-1");
        r.setIpAddress(ip);
        r.setBgpAsn(65000L);
        return r;
    }
}

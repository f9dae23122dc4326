package com.github.dimitryivaniuta.cmdb.infra;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@ActiveProfiles("test")
@TestPropertySource(properties = {
        "management.endpoints.web.exposure.include=health,info,metrics,prometheus",
        "management.prometheus.metrics.export.enabled=true"
})
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>("postgres:16-alpine")
                    .withDatabaseName("cmdb")
                    .withUsername("cmdb")
                    .withPassword("cmdb");

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    protected JdbcTemplate jdbc;

    @BeforeEach
    void cleanDatabase() {
        jdbc.execute("""
            DO $$
            DECLARE
              t text;
            BEGIN
              FOREACH t IN ARRAY ARRAY[
                'vpc', 'transit_gateway', 'customer_gateway', 'vpc_endpoint',
                'workflow_alert', 'workflow_execution', 'workflow_registry',
                'report_execution', 'report_definition',
                'audit_log', 'outbox_event', 'job_lock', 'rate_limit_hit'
              ] LOOP
                IF to_regclass('public.' || t) IS NOT NULL THEN
                  EXECUTE 'TRUNCATE TABLE ' || t || ' RESTART IDENTITY CASCADE';
                END IF;
              END LOOP;
            END$$;
            """);
    }
}

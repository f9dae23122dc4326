package com.github.dimitryivaniuta.cmdb.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.UUID;

@Slf4j
@Configuration
public class JobLockConfig {

    @Bean
    public JobLock jobLock(SchedulerProperties props, JobLockRepository repo, Clock clock) {
        String owner = hostName() + ":" + UUID.randomUUID();
        if ("memory".equals(props.getLock().getStore())) {
            log.info("Job lock store: in-memory (owner {})", owner);
            return new InMemoryJobLock(owner, clock);
        }
        log.info("Job lock store: database (owner {})", owner);
        return new JpaJobLock(repo, owner, clock);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name, using 'unknown-host': {}", e.getMessage());
            return "unknown-host";
        }
    }
}

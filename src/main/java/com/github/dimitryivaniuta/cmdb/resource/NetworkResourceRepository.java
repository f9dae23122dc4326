package com.github.dimitryivaniuta.cmdb.resource;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.Optional;

@NoRepositoryBean
public interface NetworkResourceRepository<E extends NetworkResourceEntity>
        extends JpaRepository<E, Long>, JpaSpecificationExecutor<E> {

    Optional<E> findByIdAndDeletedAtIsNull(Long id);

    Optional<E> findByExternalIdAndRegionAndDeletedAtIsNull(String externalId, String region);

    long countByDeletedAtIsNull();
}

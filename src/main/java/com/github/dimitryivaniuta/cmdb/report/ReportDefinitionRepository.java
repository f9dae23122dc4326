package com.github.dimitryivaniuta.cmdb.report;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ReportDefinitionRepository extends JpaRepository<ReportDefinition, Long> {

    Optional<ReportDefinition> findByReportId(String reportId);

    boolean existsByReportId(String reportId);

    @Query("""
            select r from ReportDefinition r
            where (:category is null or r.category = :category)
              and (:reportType is null or r.reportType = :reportType)
              and (:active is null or r.active = :active)
            """)
    Page<ReportDefinition> search(@Param("category") ReportCategory category,
                                  @Param("reportType") ReportType reportType,
                                  @Param("active") Boolean active,
                                  Pageable pageable);
}

package com.github.dimitryivaniuta.cmdb.resource;

import com.github.dimitryivaniuta.cmdb.audit.AuditTrail;
import com.github.dimitryivaniuta.cmdb.error.BusinessRuleException;
import com.github.dimitryivaniuta.cmdb.error.DatabaseErrorTranslator;
import com.github.dimitryivaniuta.cmdb.error.DuplicateResourceException;
import com.github.dimitryivaniuta.cmdb.error.ErrorDetail;
import com.github.dimitryivaniuta.cmdb.error.ResourceNotFoundException;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.support.PagingSupport;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.groups.Default;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CRUD contract shared by the four network resource types.
 * <p>
 * Every mutation runs: schema validation, business rules, the (external id, region) uniqueness
 * check, the write, then an audit record and a {@link DataChangedEvent}. Deletes are soft.
 *
 * @param <E> entity type
 * @param <R> request payload type
 */
@Slf4j
public abstract class AbstractResourceService<E extends NetworkResourceEntity, R extends ResourceRequest> {

    private static final Set<String> SORTABLE = Set.of(
            "createdAt", "updatedAt", "name", "region", "state", "externalId", "environment", "owner");

    protected final NetworkResourceRepository<E> repository;
    private final Validator validator;
    private final AuditTrail audit;
    private final ApplicationEventPublisher events;
    protected final Clock clock;

    protected AbstractResourceService(NetworkResourceRepository<E> repository,
                                      ResourceServiceSupport support) {
        this.repository = repository;
        this.validator = support.validator();
        this.audit = support.audit();
        this.events = support.events();
        this.clock = support.clock();
    }

    public abstract ResourceType resourceType();

    public abstract Class<R> requestType();

    protected abstract E newEntity();

    /** Copies the type-specific, non-null request fields onto the entity. */
    protected abstract void applySpecific(R request, E entity);

    /** Fills type-specific defaults for fields the create request left empty. */
    protected abstract void applyDefaults(E entity);

    /** Domain constraints on the resulting entity state; empty when the entity is acceptable. */
    protected abstract List<ErrorDetail> businessRuleViolations(E entity);

    @Transactional
    public E create(R request, String userId) {
        validate(request, Default.class, OnCreate.class);

        String externalId = request.externalId();
        String region = request.getRegion();
        ensureUnique(externalId, region, null);

        E entity = newEntity();
        entity.setExternalId(externalId);
        applyCommon(request, entity);
        applySpecific(request, entity);
        applyDefaults(entity);
        entity.setSyncVersion(1);
        entity.setCreatedBy(userId);
        entity.setUpdatedBy(userId);

        checkBusinessRules(entity);

        E saved = save(entity);
        audit.logOperation("CREATE", resourceType().name(), saved.getId(), userId,
                metadata(saved, "externalId", externalId));
        events.publishEvent(new DataChangedEvent(resourceType().name(), String.valueOf(saved.getId()), "CREATE"));
        return saved;
    }

    @Transactional(readOnly = true)
    public E findById(Long id) {
        return repository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> notFound(id));
    }

    @Transactional(readOnly = true)
    public Optional<E> findByExternalId(String externalId, String region) {
        return repository.findByExternalIdAndRegionAndDeletedAtIsNull(externalId, region);
    }

    @Transactional
    public E update(Long id, R request, String userId) {
        validate(request, Default.class);
        E entity = findById(id);

        String externalId = Optional.ofNullable(request.externalId()).orElse(entity.getExternalId());
        String region = Optional.ofNullable(request.getRegion()).orElse(entity.getRegion());
        if (!externalId.equals(entity.getExternalId()) || !region.equals(entity.getRegion())) {
            ensureUnique(externalId, region, entity.getId());
        }

        entity.setExternalId(externalId);
        applyCommon(request, entity);
        applySpecific(request, entity);
        entity.setSyncVersion(entity.getSyncVersion() + 1);
        entity.setUpdatedBy(userId);

        checkBusinessRules(entity);

        E saved = save(entity);
        audit.logOperation("UPDATE", resourceType().name(), saved.getId(), userId,
                metadata(saved, "syncVersion", saved.getSyncVersion()));
        events.publishEvent(new DataChangedEvent(resourceType().name(), String.valueOf(saved.getId()), "UPDATE"));
        return saved;
    }

    @Transactional
    public E delete(Long id, String userId) {
        E entity = findById(id);
        entity.setDeletedAt(clock.instant());
        entity.setUpdatedBy(userId);
        E saved = save(entity);
        audit.logOperation("DELETE", resourceType().name(), saved.getId(), userId,
                metadata(saved, "externalId", saved.getExternalId()));
        events.publishEvent(new DataChangedEvent(resourceType().name(), String.valueOf(saved.getId()), "DELETE"));
        return saved;
    }

    @Transactional(readOnly = true)
    public PageResult<E> findAll(ResourceQuery query) {
        int page = PagingSupport.page(query.page());
        int limit = PagingSupport.limit(query.limit());

        String sortBy = (query.sortBy() == null || query.sortBy().isBlank()) ? "createdAt" : query.sortBy().trim();
        if (!SORTABLE.contains(sortBy)) {
            throw ValidationFailedException.of("sortBy", "sortBy must be one of " + SORTABLE.stream().sorted().toList());
        }
        Sort.Direction direction = "ASC".equalsIgnoreCase(query.sortOrder()) ? Sort.Direction.ASC : Sort.Direction.DESC;
        Sort sort = Sort.by(direction, sortBy).and(Sort.by(direction, "id"));

        Page<E> result = repository.findAll(ResourceSpecifications.matching(query), PageRequest.of(page - 1, limit, sort));
        return PageResult.of(result.getContent(), result.getTotalElements(), page, limit);
    }

    protected void validate(Object request, Class<?>... groups) {
        if (request == null) {
            throw ValidationFailedException.of(null, "Request body is required");
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(request, groups);
        if (violations.isEmpty()) {
            return;
        }
        List<ErrorDetail> errors = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> new ErrorDetail(ValidationFailedException.CODE, v.getMessage(), v.getPropertyPath().toString()))
                .toList();
        throw new ValidationFailedException(errors);
    }

    private void ensureUnique(String externalId, String region, Long selfId) {
        repository.findByExternalIdAndRegionAndDeletedAtIsNull(externalId, region)
                .filter(existing -> !Objects.equals(existing.getId(), selfId))
                .ifPresent(existing -> {
                    throw duplicate(externalId, region);
                });
    }

    private void checkBusinessRules(E entity) {
        List<ErrorDetail> violations = businessRuleViolations(entity);
        if (!violations.isEmpty()) {
            throw new BusinessRuleException(violations);
        }
    }

    private E save(E entity) {
        try {
            return repository.saveAndFlush(entity);
        } catch (DataAccessException ex) {
            // the partial unique index also catches concurrent creates that passed ensureUnique
            if ("23505".equals(DatabaseErrorTranslator.sqlState(ex))) {
                throw duplicate(entity.getExternalId(), entity.getRegion());
            }
            log.error("{} write failed for externalId={}", resourceType().displayName(), entity.getExternalId(), ex);
            throw DatabaseErrorTranslator.translate(ex);
        }
    }

    private void applyCommon(R request, E entity) {
        if (request.getRegion() != null) entity.setRegion(request.getRegion());
        if (request.getAwsAccountId() != null) entity.setAwsAccountId(request.getAwsAccountId());
        if (request.state() != null) entity.setState(request.state());
        if (request.getName() != null) entity.setName(request.getName());
        if (request.getDescription() != null) entity.setDescription(request.getDescription());
        if (request.getTags() != null) entity.setTags(request.getTags());
        if (request.getEnvironment() != null) entity.setEnvironment(request.getEnvironment());
        if (request.getProject() != null) entity.setProject(request.getProject());
        if (request.getCostCenter() != null) entity.setCostCenter(request.getCostCenter());
        if (request.getOwner() != null) entity.setOwner(request.getOwner());
        if (request.getSourceSystem() != null) {
            entity.setSourceSystem(request.getSourceSystem());
            entity.setLastSyncAt(clock.instant());
        }
        if (entity.getSourceSystem() == null) entity.setSourceSystem("manual");
    }

    private DuplicateResourceException duplicate(String externalId, String region) {
        return new DuplicateResourceException(
                resourceType().duplicateCode(),
                resourceType().displayName() + " " + externalId + " already exists in region " + region,
                externalIdField());
    }

    private ResourceNotFoundException notFound(Long id) {
        return new ResourceNotFoundException(resourceType().notFoundCode(),
                resourceType().displayName() + " with id " + id + " not found");
    }

    /** JSON name of the external id field, reported on duplicate errors. */
    protected abstract String externalIdField();

    private static Map<String, Object> metadata(NetworkResourceEntity e, String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(key, value);
        m.put("region", e.getRegion());
        m.put("state", e.getState());
        return m;
    }
}

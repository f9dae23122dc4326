package com.github.dimitryivaniuta.cmdb.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.cmdb.error.CmdbException;
import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.resource.AbstractResourceService;
import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceEntity;
import com.github.dimitryivaniuta.cmdb.resource.ResourceRequest;
import com.github.dimitryivaniuta.cmdb.resource.ResourceServiceRegistry;
import com.github.dimitryivaniuta.cmdb.resource.ResourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies create or delete to many resources of one type. Items run one by one, each in the
 * resource service's own transaction, so one bad item does not roll back the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkOperationService {

    public static final int MAX_ITEMS = 100;
    static final String CREATE = "create";
    static final String DELETE = "delete";

    private final ResourceServiceRegistry services;
    private final ObjectMapper mapper;

    public BulkResult execute(String resourceType, BulkRequest request, String userId) {
        ResourceType type = ResourceType.parse(resourceType)
                .orElseThrow(() -> ValidationFailedException.of("resourceType", "Unknown resource type: " + resourceType));
        if (request == null || request.operation() == null) {
            throw ValidationFailedException.of("operation", "operation must be create or delete");
        }
        String operation = request.operation().trim().toLowerCase(Locale.ROOT);
        AbstractResourceService<?, ?> service = services.get(type);

        BulkResult result = switch (operation) {
            case CREATE -> createAll(service, requireSize("items", request.items()), userId);
            case DELETE -> deleteAll(service, requireSize("ids", request.ids()), userId);
            default -> throw ValidationFailedException.of("operation", "operation must be create or delete");
        };
        log.info("Bulk {} on {}: requested={} succeeded={} failed={}", operation, type.path(),
                result.requested(), result.succeeded(), result.errors().size());
        return result;
    }

    private BulkResult createAll(AbstractResourceService<?, ?> service, List<JsonNode> items, String userId) {
        List<Long> ids = new ArrayList<>();
        List<BulkResult.ItemError> errors = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            try {
                ids.add(createOne(service, items.get(i), userId));
            } catch (JsonProcessingException ex) {
                errors.add(new BulkResult.ItemError(i, null, ValidationFailedException.CODE,
                        "Item is not a valid " + service.resourceType().displayName() + " payload: " + ex.getOriginalMessage()));
            } catch (CmdbException ex) {
                errors.add(new BulkResult.ItemError(i, null, ex.getCode(), describe(ex)));
            }
        }
        return new BulkResult(CREATE, items.size(), ids.size(), ids, errors);
    }

    private BulkResult deleteAll(AbstractResourceService<?, ?> service, List<Long> targets, String userId) {
        List<Long> ids = new ArrayList<>();
        List<BulkResult.ItemError> errors = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            Long id = targets.get(i);
            if (id == null) {
                errors.add(new BulkResult.ItemError(i, null, ValidationFailedException.CODE, "id is required"));
                continue;
            }
            try {
                ids.add(service.delete(id, userId).getId());
            } catch (CmdbException ex) {
                errors.add(new BulkResult.ItemError(i, id, ex.getCode(), describe(ex)));
            }
        }
        return new BulkResult(DELETE, targets.size(), ids.size(), ids, errors);
    }

    private <E extends NetworkResourceEntity, R extends ResourceRequest> Long createOne(
            AbstractResourceService<E, R> service, JsonNode item, String userId) throws JsonProcessingException {
        R request = mapper.treeToValue(item, service.requestType());
        return service.create(request, userId).getId();
    }

    private static <T> List<T> requireSize(String field, List<T> values) {
        if (values == null || values.isEmpty()) {
            throw ValidationFailedException.of(field, field + " must not be empty");
        }
        if (values.size() > MAX_ITEMS) {
            throw ValidationFailedException.of(field, field + " may hold at most " + MAX_ITEMS + " entries");
        }
        return values;
    }

    private static String describe(CmdbException ex) {
        if (ex.getErrors().size() == 1) {
            return ex.getErrors().get(0).message();
        }
        return ex.getMessage() + ": " + ex.getErrors().stream()
                .map(e -> e.field() == null ? e.message() : e.field() + " " + e.message())
                .toList();
    }
}

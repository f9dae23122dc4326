package com.github.dimitryivaniuta.cmdb.resource;

import com.github.dimitryivaniuta.cmdb.web.ApiResponse;
import com.github.dimitryivaniuta.cmdb.web.RequestContextKeys;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST mapping shared by the resource controllers; subclasses only supply the base path and service.
 */
public abstract class AbstractResourceController<E extends NetworkResourceEntity, R extends ResourceRequest> {

    protected abstract AbstractResourceService<E, R> service();

    @GetMapping
    public ApiResponse<List<E>> list(ResourceQuery query) {
        PageResult<E> result = service().findAll(query);
        return ApiResponse.page(result.data(), result.toMeta());
    }

    @GetMapping("/{id}")
    public ApiResponse<E> get(@PathVariable Long id) {
        return ApiResponse.ok(service().findById(id));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<E>> create(
            @RequestBody R request,
            @RequestHeader(value = RequestContextKeys.USER_ID_HEADER, defaultValue = RequestContextKeys.DEFAULT_USER_ID) String userId) {
        E created = service().create(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(created, service().resourceType().displayName() + " created successfully"));
    }

    @PutMapping("/{id}")
    public ApiResponse<E> update(
            @PathVariable Long id,
            @RequestBody R request,
            @RequestHeader(value = RequestContextKeys.USER_ID_HEADER, defaultValue = RequestContextKeys.DEFAULT_USER_ID) String userId) {
        return ApiResponse.ok(service().update(id, request, userId),
                service().resourceType().displayName() + " updated successfully");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<E> delete(
            @PathVariable Long id,
            @RequestHeader(value = RequestContextKeys.USER_ID_HEADER, defaultValue = RequestContextKeys.DEFAULT_USER_ID) String userId) {
        return ApiResponse.ok(service().delete(id, userId),
                service().resourceType().displayName() + " deleted successfully");
    }
}

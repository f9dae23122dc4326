package com.github.dimitryivaniuta.cmdb.bulk;

import com.github.dimitryivaniuta.cmdb.web.ApiResponse;
import com.github.dimitryivaniuta.cmdb.web.RequestContextKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/bulk")
public class BulkController {

    private final BulkOperationService service;

    @PostMapping("/{resourceType}")
    public ApiResponse<BulkResult> execute(
            @PathVariable String resourceType,
            @RequestBody BulkRequest request,
            @RequestHeader(value = RequestContextKeys.USER_ID_HEADER, defaultValue = RequestContextKeys.DEFAULT_USER_ID) String userId) {
        BulkResult result = service.execute(resourceType, request, userId);
        return ApiResponse.ok(result, result.succeeded() + " of " + result.requested() + " items succeeded");
    }
}

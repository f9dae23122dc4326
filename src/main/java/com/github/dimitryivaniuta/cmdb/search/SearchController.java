package com.github.dimitryivaniuta.cmdb.search;

import com.github.dimitryivaniuta.cmdb.web.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/search")
public class SearchController {

    private final SearchService service;

    @GetMapping
    public ApiResponse<List<SearchHit>> search(
            @RequestParam(name = "q", required = false) String q,
            @RequestParam(required = false) String types,
            @RequestParam(required = false) String region,
            @RequestParam(required = false) Integer limit) {
        return ApiResponse.ok(service.search(q, types, region, limit));
    }
}

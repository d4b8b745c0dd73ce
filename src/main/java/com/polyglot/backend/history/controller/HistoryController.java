package com.polyglot.backend.history.controller;

import com.polyglot.backend.auth.security.AuthContext;
import com.polyglot.backend.history.dto.HistoryDtos;
import com.polyglot.backend.history.service.HistoryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "History", description = "Translation history: list / search / clear")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private final AuthContext auth;
    private final HistoryService service;

    @GetMapping
    public HistoryDtos.HistoryPageResponse list(
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "per_page", required = false) Integer perPage,
            @RequestParam(value = "type", required = false) String type
    ) {
        return service.list(auth.requireUserEmail(), type, page, perPage);
    }

    @GetMapping("/search")
    public HistoryDtos.SearchResponse search(
            @RequestParam(value = "query", required = false) String query,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return service.search(auth.requireUserEmail(), query, limit);
    }

    @GetMapping("/{id}")
    public HistoryDtos.TranslationResponse getOne(@PathVariable("id") Long id) {
        return new HistoryDtos.TranslationResponse(true, service.get(auth.requireUserEmail(), id));
    }

    @PostMapping("/clear")
    public HistoryDtos.ClearResponse clear(@RequestParam(value = "confirm", required = false) Boolean confirm) {
        return service.clear(auth.requireUserEmail(), confirm);
    }
}

package com.polyglot.backend.analytics.controller;

import com.polyglot.backend.analytics.dto.AnalyticsViews;
import com.polyglot.backend.analytics.service.AnalyticsService;
import com.polyglot.backend.auth.security.AuthContext;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Analytics", description = "Dashboard, statistics, daily trend and language analytics")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1")
public class AnalyticsController {

    private final AuthContext auth;
    private final AnalyticsService service;

    @GetMapping("/dashboard")
    public AnalyticsViews.DashboardView dashboard() {
        return service.dashboard(auth.requireUserEmail());
    }

    /** period：7 / 30 / 90 / all */
    @GetMapping("/statistics")
    public AnalyticsViews.StatisticsView statistics(
            @RequestParam(value = "period", required = false, defaultValue = "30") String period
    ) {
        return service.statistics(auth.requireUserEmail(), period);
    }

    @GetMapping("/analytics/daily")
    public AnalyticsViews.DailyAnalyticsView daily(@RequestParam(value = "days", required = false) Integer days) {
        return service.daily(auth.requireUserEmail(), days);
    }

    @GetMapping("/analytics/languages")
    public AnalyticsViews.LanguageAnalyticsView languages() {
        return service.languages(auth.requireUserEmail());
    }

    @PutMapping("/analytics/languages/favorite")
    public AnalyticsViews.FavoritePairResponse favorite(@RequestBody AnalyticsViews.FavoritePairRequest body) {
        var pair = service.setFavoritePair(
                auth.requireUserEmail(), body.sourceLanguage(), body.targetLanguage(), body.favorite());
        return new AnalyticsViews.FavoritePairResponse(true, pair);
    }
}

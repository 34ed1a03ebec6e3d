package com.hits.controller.rest;

import com.hits.service.core.aggregate.AggregationService;
import com.hits.service.core.aggregate.HitAggregate;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only statistics; does not record a hit. */
@RestController
@RequestMapping(path = "/api/stats", produces = MediaType.APPLICATION_JSON_VALUE)
public class StatsController {

    private final AggregationService aggregationService;

    public StatsController(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    @GetMapping("/{key}")
    public ResponseEntity<HitAggregate> stats(@PathVariable("key") String key) {
        return ResponseEntity.ok().headers(NoCacheHeaders.create()).body(aggregationService.aggregate(key));
    }
}

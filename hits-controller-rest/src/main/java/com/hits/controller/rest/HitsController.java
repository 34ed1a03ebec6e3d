package com.hits.controller.rest;

import com.hits.service.core.config.HitsProperties;
import com.hits.service.core.counter.HitCounterService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/** Hit endpoints. Every request records one hit for the key and answers with the new total. */
@RestController
public class HitsController {

    private final HitCounterService hitCounterService;
    private final HitsProperties properties;

    public HitsController(HitCounterService hitCounterService, HitsProperties properties) {
        this.hitCounterService = hitCounterService;
        this.properties = properties;
    }

    @GetMapping(path = "/hits/{key}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Long> hit(@PathVariable("key") String key) {
        long total = hitCounterService.recordHitAndGetTotal(key);
        return ResponseEntity.ok().headers(NoCacheHeaders.create()).body(total);
    }

    @GetMapping(path = "/badge/{key}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ShieldsIoBadge> badge(@PathVariable("key") String key) {
        long total = hitCounterService.recordHitAndGetTotal(key);
        HitsProperties.Badge badge = properties.getBadge();
        return ResponseEntity.ok()
                .headers(NoCacheHeaders.create())
                .body(ShieldsIoBadge.of(badge.getLabel(), total, badge.getColor()));
    }
}

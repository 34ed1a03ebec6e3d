package com.hits.controller.rest;

import org.springframework.http.HttpHeaders;

/** Headers that keep badge proxies (GitHub camo, shields.io) from caching counts. */
final class NoCacheHeaders {

    private NoCacheHeaders() {}

    static HttpHeaders create() {
        HttpHeaders headers = new HttpHeaders();
        headers.setCacheControl("no-cache, no-store, must-revalidate");
        headers.setPragma("no-cache");
        headers.set(HttpHeaders.EXPIRES, "0");
        return headers;
    }
}

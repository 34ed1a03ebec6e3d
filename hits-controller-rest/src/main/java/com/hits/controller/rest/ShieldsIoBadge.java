package com.hits.controller.rest;

/**
 * shields.io endpoint-badge document.
 *
 * @see <a href="https://shields.io/badges/endpoint-badge">endpoint badge schema</a>
 */
public record ShieldsIoBadge(int schemaVersion, String label, String message, String color) {

    public static ShieldsIoBadge of(String label, long count, String color) {
        return new ShieldsIoBadge(1, label, Long.toString(count), color);
    }
}

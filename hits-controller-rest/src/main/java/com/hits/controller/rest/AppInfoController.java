package com.hits.controller.rest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AppInfoController {

    private final AppInfo info;

    public AppInfoController(
            @Value("${hits.info.project-name:Hits}") String projectName,
            @Value("${hits.info.version:dev}") String version) {
        this.info = new AppInfo(projectName, version);
    }

    @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public AppInfo info() {
        return info;
    }

    public record AppInfo(String projectName, String version) {}
}

package org.xcos.csp.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.xcos.csp.config.XcosProperties;

@RestController
public class InfoController {

    private final XcosProperties properties;

    public InfoController(XcosProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("name", properties.getName());
        info.put("version", properties.getVersion());
        info.put("description", properties.getDescription());
        info.put("docs", properties.getDocs());
        return info;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}

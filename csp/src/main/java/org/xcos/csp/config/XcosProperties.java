package org.xcos.csp.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Settings bound from the {@code xcos.*} keys of application.properties.
 */
@Data
@ConfigurationProperties(prefix = "xcos")
public class XcosProperties {

    private String name = "xCoS Dashboard API";
    private String version = "0.1.0";
    private String description = "Explainable Constraint Solving Dashboard";
    private String docs = "/api/docs";

    private Solver solver = new Solver();
    private Cors cors = new Cors();

    @Data
    public static class Solver {
        // Seconds; applied when a solve request does not name its own timeout
        private int defaultTimeout = 30;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:5173", "http://localhost:3000"));
    }
}

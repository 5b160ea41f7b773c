package com.github.dimitryivaniuta.gatekeeper.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** Liveness endpoints for load balancers. Both paths are public routes by default. */
@RestController
public class HealthController {

    private static final Map<String, String> UP = Map.of("message", "Application Up And Running");

    @GetMapping({"/", "/healthcheck"})
    public Map<String, String> health() {
        return UP;
    }
}

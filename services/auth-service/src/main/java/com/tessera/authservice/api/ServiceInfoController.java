package com.tessera.authservice.api;

import com.tessera.authservice.config.TesseraProperties;
import com.tessera.token.KeyRing;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight runtime information about the service.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final TesseraProperties properties;
    private final KeyRing keyRing;
    private final Clock clock;

    public ServiceInfoController(TesseraProperties properties, KeyRing keyRing, Clock clock) {
        this.properties = properties;
        this.keyRing = keyRing;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.serviceName());
        info.put("environment", properties.environment());
        info.put("status", keyRing.isInitialized() ? "running" : "starting");
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}

package com.phillippitts.mcphub.presentation.controller;

import com.phillippitts.mcphub.service.backend.BackendDescriptor;
import com.phillippitts.mcphub.service.backend.CapabilityChain;
import com.phillippitts.mcphub.service.registry.Catalog;
import com.phillippitts.mcphub.service.registry.ServiceRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lists what the current catalog can run.
 */
@RestController
class CatalogController {

    private final ServiceRegistry registry;

    CatalogController(ServiceRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/api/catalog")
    Map<String, Object> catalog() {
        Catalog catalog = registry.catalog();

        Map<String, Object> capabilities = new TreeMap<>();
        for (CapabilityChain chain : catalog.chains().values()) {
            List<Map<String, Object>> backends = new ArrayList<>();
            for (BackendDescriptor d : chain.backends()) {
                Map<String, Object> b = new LinkedHashMap<>();
                b.put("name", d.name());
                b.put("priority", d.priority());
                b.put("fallback", d.fallback());
                b.put("invokeTimeoutMs", d.invokeTimeout().toMillis());
                backends.add(b);
            }
            capabilities.put(chain.capability(), Map.of("optional", chain.optional(), "backends", backends));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("generation", catalog.generation());
        body.put("kinds", catalog.kinds());
        body.put("capabilities", capabilities);
        return body;
    }
}

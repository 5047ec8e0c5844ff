package com.phillippitts.mcphub.service.registry;

import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Registers the configured catalog at startup and builds it. Any configuration error aborts
 * startup, so the process never serves with an invalid catalog.
 */
@Component
class RegistryInitializer {
    private static final Logger LOG = LogManager.getLogger(RegistryInitializer.class);

    private final ServiceRegistry registry;
    private final ConfiguredRegistrations registrations;

    RegistryInitializer(ServiceRegistry registry, ConfiguredRegistrations registrations) {
        this.registry = registry;
        this.registrations = registrations;
    }

    @PostConstruct
    void buildOnStartup() {
        RegistrationSet set = registrations.load();
        set.backends().forEach(registry::registerBackend);
        set.components().forEach(registry::registerComponent);
        set.graphs().forEach(registry::registerGraph);
        set.optionalCapabilities().forEach(registry::markOptional);
        Catalog catalog = registry.build();
        LOG.info("Serving task kinds: {}", catalog.kinds());
    }
}

package com.tessera.authzservice.config;

import com.tessera.authorization.policy.PolicyCatalog;
import com.tessera.authorization.policy.PolicyConfigException;
import com.tessera.authorization.policy.PolicySource;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/** Reads the configured policy document; used at startup and by the reload endpoint. */
public class PolicyCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyCatalogLoader.class);

    private final ResourceLoader resourceLoader;
    private final AuthorizationProperties properties;

    public PolicyCatalogLoader(ResourceLoader resourceLoader, AuthorizationProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    /**
     * Parses, normalizes and validates the document at {@code tessera.authorization.policy-location}.
     *
     * @throws PolicyConfigException if the document is missing, unreadable or invalid
     */
    public PolicyCatalog load() {
        String location = properties.policyLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PolicyConfigException("Policy document not found: " + location, null);
        }
        try (InputStream in = resource.getInputStream()) {
            PolicyCatalog catalog = PolicySource.load(in);
            log.info("Loaded policy catalog from {} with roles {}", location, catalog.roleNames());
            return catalog;
        } catch (IOException e) {
            throw new PolicyConfigException("Failed to read policy document " + location, e);
        }
    }

    public List<String> configuredTenants() {
        return properties.tenants();
    }
}

package com.tessera.authzservice.config;

import com.tessera.authorization.AuthorizationService;
import com.tessera.authorization.assignment.AssignmentStore;
import com.tessera.authorization.interceptor.EndpointAuthorizationInterceptor;
import com.tessera.authorization.interceptor.EndpointPermissions;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Builds the authorization core.
 *
 * <p>The {@link AssignmentStore} comes from the database module ({@code tessera.database.enabled})
 * or, in tests, from a test configuration. Startup fails if the policy document is invalid or the
 * store cannot be read; the service never serves without both.
 */
@Configuration
@EnableConfigurationProperties(AuthorizationProperties.class)
public class AuthorizationConfig {

    @Bean
    public PolicyCatalogLoader policyCatalogLoader(
            ResourceLoader resourceLoader, AuthorizationProperties properties) {
        return new PolicyCatalogLoader(resourceLoader, properties);
    }

    @Bean
    public AuthorizationService authorizationService(
            PolicyCatalogLoader policyCatalogLoader, AssignmentStore assignmentStore) {
        return AuthorizationService.start(
                policyCatalogLoader.load(), policyCatalogLoader.configuredTenants(), assignmentStore);
    }

    @Bean
    public EndpointPermissions endpointPermissions(AuthorizationProperties properties) {
        return properties.toEndpointPermissions();
    }

    @Bean
    public EndpointAuthorizationInterceptor endpointAuthorizationInterceptor(
            AuthorizationService authorizationService, EndpointPermissions endpointPermissions) {
        return new EndpointAuthorizationInterceptor(authorizationService, endpointPermissions);
    }
}

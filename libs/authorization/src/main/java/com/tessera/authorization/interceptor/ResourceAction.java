package com.tessera.authorization.interceptor;

/**
 * The (resource, action) an endpoint requires.
 *
 * @param resource resource name as used in the policy catalog
 * @param action action name as used in the policy catalog
 */
public record ResourceAction(String resource, String action) {}

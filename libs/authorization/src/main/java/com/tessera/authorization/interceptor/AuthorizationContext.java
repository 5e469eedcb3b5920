package com.tessera.authorization.interceptor;

/**
 * What was authorized for the request currently being handled.
 *
 * @param userId authorized user
 * @param tenantId tenant the request is scoped to
 * @param resource resource that was checked
 * @param action action that was checked
 */
public record AuthorizationContext(String userId, String tenantId, String resource, String action) {

    /** MDC key for the user id. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for the tenant id. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the checked resource. */
    public static final String MDC_RESOURCE = "authzResource";

    /** MDC key for the checked action. */
    public static final String MDC_ACTION = "authzAction";
}

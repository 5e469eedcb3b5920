package com.tessera.authorization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks the identifiers passed to {@link AuthorizationService} operations.
 *
 * <p>Every field is checked and all errors are reported at once, so a caller that sends an empty
 * user and an empty tenant learns about both in one round trip.
 */
public final class ArgumentValidator {

    private ArgumentValidator() {
        // utility class
    }

    /**
     * Validates that every named value is non-null and non-blank.
     *
     * @param fields field name to value, checked in iteration order
     * @return a {@link ValidationResult} listing each blank field
     */
    public static ValidationResult validate(Map<String, String> fields) {
        var errors = new ArrayList<String>();
        fields.forEach(
                (name, value) -> {
                    if (isBlank(value)) {
                        errors.add(name + " must not be null or blank");
                    }
                });
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Throws {@link InvalidArgumentException} unless every named value is non-blank.
     *
     * @param namesAndValues alternating field names and values: {@code "userId", userId, ...}
     */
    public static void requireNonBlank(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("namesAndValues must come in pairs");
        }
        var fields = new LinkedHashMap<String, String>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            fields.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        requireValid(validate(fields));
    }

    /** Throws {@link InvalidArgumentException} if the tenant list is null, empty or has a blank id. */
    public static void requireTenants(Collection<String> tenants) {
        if (tenants == null || tenants.isEmpty()) {
            throw new InvalidArgumentException("tenants must contain at least one tenant");
        }
        var errors = new ArrayList<String>();
        int index = 0;
        for (String tenant : tenants) {
            if (isBlank(tenant)) {
                errors.add("tenants[" + index + "] must not be null or blank");
            }
            index++;
        }
        if (!errors.isEmpty()) {
            throw new InvalidArgumentException(errors);
        }
    }

    static void requireValid(ValidationResult result) {
        if (!result.valid()) {
            throw new InvalidArgumentException(result.errors());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

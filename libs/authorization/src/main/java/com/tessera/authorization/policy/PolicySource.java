package com.tessera.authorization.policy;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tessera.authorization.ValidationResult;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the declarative permission catalog.
 *
 * <p>The pipeline has three independent, pure stages:
 *
 * <ol>
 *   <li>{@link #parse(String)}: YAML text to {@link PolicyDocument}
 *   <li>{@link #normalize(PolicyDocument)}: trims names, translates {@code all} to {@link
 *       Permission#WILDCARD}
 *   <li>{@link #validate(PolicyCatalog)}: structural rules, all errors reported at once
 * </ol>
 *
 * <p>{@link #load(Path)} runs all three and throws {@link PolicyConfigException} on the first
 * failing stage.
 */
public final class PolicySource {

    private static final ObjectMapper MAPPER =
            new ObjectMapper(new YAMLFactory())
                    .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                    .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private PolicySource() {
        // utility class
    }

    // ── Stage 1: parse ──

    /**
     * Parses a YAML policy document.
     *
     * @throws PolicyConfigException if the text is not a well-formed policy document
     */
    public static PolicyDocument parse(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            throw new PolicyConfigException("Policy document is empty", null);
        }
        try {
            return requireContent(MAPPER.readValue(yaml, PolicyDocument.class));
        } catch (JsonProcessingException e) {
            throw new PolicyConfigException("Failed to parse policy document", e);
        }
    }

    /**
     * Parses a YAML policy document from a stream. The stream is not closed.
     *
     * @throws PolicyConfigException if the stream cannot be read or is malformed
     */
    public static PolicyDocument parse(InputStream in) {
        try {
            return requireContent(MAPPER.readValue(in, PolicyDocument.class));
        } catch (JsonProcessingException e) {
            throw new PolicyConfigException("Failed to parse policy document", e);
        } catch (IOException e) {
            throw new PolicyConfigException("Failed to read policy document", e);
        }
    }

    // ── Stage 2: normalize ──

    /**
     * Translates a raw document into a catalog. Missing bodies become empty collections so that
     * {@link #validate(PolicyCatalog)} can report them.
     *
     * @throws PolicyConfigException if two role names are equal once trimmed
     */
    public static PolicyCatalog normalize(PolicyDocument document) {
        var roles = new LinkedHashMap<String, RoleDefinition>();
        if (document.roles() == null) {
            return new PolicyCatalog(roles);
        }
        var duplicates = new ArrayList<String>();
        document.roles()
                .forEach(
                        (roleName, body) -> {
                            String name = trim(roleName);
                            if (roles.containsKey(name)) {
                                duplicates.add("role '%s' is declared more than once".formatted(name));
                                return;
                            }
                            roles.put(name, new RoleDefinition(name, normalizeGrants(body)));
                        });
        if (!duplicates.isEmpty()) {
            throw new PolicyConfigException(duplicates);
        }
        return new PolicyCatalog(roles);
    }

    /** Maps the human {@code all} token to {@link Permission#WILDCARD}; other tokens pass through. */
    public static String normalizeToken(String token) {
        String trimmed = trim(token);
        return Permission.ALL_TOKEN.equals(trimmed) ? Permission.WILDCARD : trimmed;
    }

    // ── Stage 3: validate ──

    /**
     * Checks that the catalog defines at least one role, every role grants at least one resource,
     * every resource lists at least one action, and no name is blank.
     */
    public static ValidationResult validate(PolicyCatalog catalog) {
        var errors = new ArrayList<String>();

        if (catalog.roles().isEmpty()) {
            errors.add("no roles defined in policy catalog");
        }

        catalog.roles()
                .forEach(
                        (roleName, role) -> {
                            if (roleName.isEmpty()) {
                                errors.add("role name must not be blank");
                            }
                            if (role.grants().isEmpty()) {
                                errors.add("role '%s' has no permissions defined".formatted(roleName));
                            }
                            role.grants()
                                    .forEach(
                                            (resource, actions) -> {
                                                if (resource.isEmpty()) {
                                                    errors.add(
                                                            "role '%s' has a blank resource name"
                                                                    .formatted(roleName));
                                                }
                                                if (actions.isEmpty()) {
                                                    errors.add(
                                                            "role '%s' resource '%s' has no actions defined"
                                                                    .formatted(roleName, resource));
                                                } else if (actions.contains("")) {
                                                    errors.add(
                                                            "role '%s' resource '%s' has a blank action"
                                                                    .formatted(roleName, resource));
                                                }
                                            });
                        });

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /** Throws {@link PolicyConfigException} carrying every error if the catalog is invalid. */
    public static PolicyCatalog requireValid(PolicyCatalog catalog) {
        ValidationResult result = validate(catalog);
        if (!result.valid()) {
            throw new PolicyConfigException(result.errors());
        }
        return catalog;
    }

    // ── Whole pipeline ──

    /** Reads, parses, normalizes and validates the policy file at {@code path}. */
    public static PolicyCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new PolicyConfigException("Failed to read policy file " + path, e);
        }
    }

    /** Parses, normalizes and validates a policy document from a stream. */
    public static PolicyCatalog load(InputStream in) {
        return requireValid(normalize(parse(in)));
    }

    /** Parses, normalizes and validates YAML text. */
    public static PolicyCatalog loadYaml(String yaml) {
        return requireValid(normalize(parse(yaml)));
    }

    /** The static role-name catalog, used to validate assignments. */
    public static List<String> roles(PolicyCatalog catalog) {
        return catalog.roleNames();
    }

    // ── Private Helpers ──

    private static Map<String, Set<String>> normalizeGrants(PolicyDocument.RoleDocument body) {
        var grants = new LinkedHashMap<String, Set<String>>();
        if (body == null || body.permissions() == null) {
            return grants;
        }
        body.permissions()
                .forEach(
                        (resource, actions) -> {
                            var normalized = new LinkedHashSet<String>();
                            if (actions != null) {
                                actions.forEach(action -> normalized.add(normalizeToken(action)));
                            }
                            grants.merge(
                                    normalizeToken(resource),
                                    normalized,
                                    (left, right) -> {
                                        left.addAll(right);
                                        return left;
                                    });
                        });
        return grants;
    }

    private static PolicyDocument requireContent(PolicyDocument document) {
        if (document == null) {
            throw new PolicyConfigException("Policy document is empty", null);
        }
        return document;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}

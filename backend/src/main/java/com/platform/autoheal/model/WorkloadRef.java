package com.platform.autoheal.model;

import com.platform.autoheal.error.ValidationException;

import java.util.regex.Pattern;

/**
 * Identity of a managed Deployment: namespace plus name.
 */
public record WorkloadRef(String namespace, String name) {

    private static final Pattern DNS_1123 = Pattern.compile("[a-z0-9]([-a-z0-9.]*[a-z0-9])?");
    private static final int MAX_LENGTH = 253;

    public WorkloadRef {
        validate("namespace", namespace);
        validate("name", name);
    }

    public static WorkloadRef of(String namespace, String name) {
        return new WorkloadRef(namespace, name);
    }

    /**
     * Parses the {@code namespace/name} form used in configuration and logs.
     */
    public static WorkloadRef parse(String value) {
        if (value == null || value.indexOf('/') < 0) {
            throw new ValidationException("workload", value, "expected namespace/name");
        }
        int slash = value.indexOf('/');
        return new WorkloadRef(value.substring(0, slash), value.substring(slash + 1));
    }

    private static void validate(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, value, "must not be blank");
        }
        if (value.length() > MAX_LENGTH || !DNS_1123.matcher(value).matches()) {
            throw new ValidationException(field, value, "must be a DNS-1123 name");
        }
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}

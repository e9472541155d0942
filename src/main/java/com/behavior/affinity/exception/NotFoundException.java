package com.behavior.affinity.exception;

/**
 * Thrown when a tenant or cohort display name cannot be resolved.
 * Fatal to the batch run; not retried automatically.
 */
public class NotFoundException extends AffinityException {

    private final String kind;
    private final String name;

    public NotFoundException(String kind, String name) {
        super(kind + " not found: '" + name + "'");
        this.kind = kind;
        this.name = name;
    }

    public static NotFoundException tenant(String tenantName) {
        return new NotFoundException("Tenant", tenantName);
    }

    public static NotFoundException cohort(String cohortName) {
        return new NotFoundException("Cohort", cohortName);
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}

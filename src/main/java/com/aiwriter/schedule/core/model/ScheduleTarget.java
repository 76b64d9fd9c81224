package com.aiwriter.schedule.core.model;

/**
 * Where a scheduled job delivers its payload and under which authority.
 *
 * <ul>
 *   <li>{@code targetRef}: invocation target of the fired job (dispatch subject).</li>
 *   <li>{@code roleRef}: credential/role the scheduler assumes when invoking the target.</li>
 *   <li>{@code groupRef}: scheduler job group that namespaces job names.</li>
 * </ul>
 *
 * <p>Built once from deployment configuration and injected into the registrar.</p>
 */
public record ScheduleTarget(String targetRef, String roleRef, String groupRef) {

    public ScheduleTarget {
        requireText(targetRef, "targetRef");
        requireText(groupRef, "groupRef");
        if (roleRef == null) {
            roleRef = "";
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}

package io.agentcron.core;

/**
 * Partial update of a {@link JobDefinition}. Null fields are left unchanged.
 */
public record JobPatch(
        String name,
        String info,
        String timeSpec,
        String prompt,
        Boolean enabled
) {

    public boolean isEmpty() {
        return name == null
                && info == null
                && timeSpec == null
                && prompt == null
                && enabled == null;
    }
}

package io.olmwatch.model;

/**
 * Well-known reasons reported next to a {@link CsvPhase}. Reasons stay plain strings because
 * the cluster may report values this list does not know about.
 */
public final class CsvReason {

    public static final String REQUIREMENTS_UNKNOWN = "RequirementsUnknown";
    public static final String REQUIREMENTS_NOT_MET = "RequirementsNotMet";
    public static final String REQUIREMENTS_MET = "AllRequirementsMet";
    public static final String OWNER_CONFLICT = "OwnerConflict";
    public static final String COMPONENT_FAILED = "InstallComponentFailed";
    public static final String INVALID_STRATEGY = "InvalidInstallStrategy";
    public static final String INSTALL_SUCCESSFUL = "InstallSucceeded";
    public static final String INSTALL_CHECK_FAILED = "InstallCheckFailed";
    public static final String COMPONENT_UNHEALTHY = "ComponentUnhealthy";
    public static final String BEING_REPLACED = "BeingReplaced";
    public static final String REPLACED = "Replaced";
    public static final String NEEDS_REINSTALL = "NeedsReinstall";
    public static final String CANNOT_MODIFY_STATIC_OPERATOR_GROUP_PROVIDED_APIS = "CannotModifyStaticOperatorGroupProvidedAPIs";

    /**
     * Marks a CSV that was copied into another namespace from its origin.
     */
    public static final String COPIED = "Copied";

    private CsvReason() {
    }
}

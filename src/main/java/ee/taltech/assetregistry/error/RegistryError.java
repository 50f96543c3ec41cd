package ee.taltech.assetregistry.error;

/**
 * Failure kinds a registry operation can end with.
 */
public enum RegistryError {

    /** Reserved for administrator-gated operations; none exist yet. */
    INSUFFICIENT_PRIVILEGES,
    ASSET_NOT_FOUND,
    /** Reserved; the monotonic counter makes id collisions impossible. */
    DUPLICATE_ENTRY,
    INVALID_PARAMETERS,
    CAPACITY_EXCEEDED,
    /** Reserved, not raised by any current operation. */
    ACCESS_DENIED,
    PERMISSION_DENIED,
    CONTENT_RESTRICTED,
    FORMAT_VALIDATION
}

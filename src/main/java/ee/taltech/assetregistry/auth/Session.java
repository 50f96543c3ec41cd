package ee.taltech.assetregistry.auth;

/**
 * Caller identity for one operation, as supplied by the host.
 * The registry trusts it as given.
 */
public record Session(String principal) {

    public Session {
        if (principal == null || principal.isBlank()) {
            throw new SecurityException("Not authenticated.");
        }
    }
}

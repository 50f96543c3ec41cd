package ee.taltech.assetregistry.error;

/**
 * Thrown when a registry operation is rejected.
 * Unchecked so the surrounding transaction rolls back.
 */
public class RegistryException extends RuntimeException {

    private final RegistryError error;

    public RegistryException(RegistryError error, String message) {
        super(message);
        this.error = error;
    }

    public RegistryError error() {
        return error;
    }

    public static RegistryException assetNotFound(long assetId) {
        return new RegistryException(RegistryError.ASSET_NOT_FOUND, "Asset not found: " + assetId);
    }
}

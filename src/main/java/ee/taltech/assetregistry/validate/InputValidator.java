package ee.taltech.assetregistry.validate;

import ee.taltech.assetregistry.error.RegistryError;
import ee.taltech.assetregistry.error.RegistryException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Field checks shared by asset creation and update.
 * Text limits are in UTF-8 bytes.
 */
@Component
public class InputValidator {

    public static final int MAX_NAME_BYTES = 64;
    public static final int MAX_DESCRIPTION_BYTES = 128;
    public static final long MAX_SIZE_BYTES_EXCLUSIVE = 1_000_000_000L;
    public static final int MAX_TAGS = 10;
    public static final int MAX_TAG_BYTES = 32;
    public static final int MAX_PRINCIPAL_LENGTH = 128;

    /**
     * Runs every asset field check in registry order: name, size, description, tags.
     */
    public void validateAssetFields(String name, long sizeBytes, String description, List<String> tags) {
        validateName(name);
        validateSize(sizeBytes);
        validateDescription(description);
        validateTags(tags);
    }

    public void validateName(String name) {
        int len = byteLength(name);
        if (len == 0 || len > MAX_NAME_BYTES) {
            throw new RegistryException(RegistryError.INVALID_PARAMETERS,
                    "Name must be 1 to " + MAX_NAME_BYTES + " bytes.");
        }
    }

    public void validateSize(long sizeBytes) {
        if (sizeBytes <= 0 || sizeBytes >= MAX_SIZE_BYTES_EXCLUSIVE) {
            throw new RegistryException(RegistryError.CAPACITY_EXCEEDED,
                    "Size must be between 1 and " + (MAX_SIZE_BYTES_EXCLUSIVE - 1) + " bytes.");
        }
    }

    public void validateDescription(String description) {
        int len = byteLength(description);
        if (len == 0 || len > MAX_DESCRIPTION_BYTES) {
            throw new RegistryException(RegistryError.INVALID_PARAMETERS,
                    "Description must be 1 to " + MAX_DESCRIPTION_BYTES + " bytes.");
        }
    }

    public void validateTags(List<String> tags) {
        if (tags == null || tags.isEmpty() || tags.size() > MAX_TAGS) {
            throw new RegistryException(RegistryError.FORMAT_VALIDATION,
                    "Tag list must hold 1 to " + MAX_TAGS + " tags.");
        }
        for (String tag : tags) {
            int len = byteLength(tag);
            if (len == 0 || len > MAX_TAG_BYTES) {
                throw new RegistryException(RegistryError.FORMAT_VALIDATION,
                        "Each tag must be 1 to " + MAX_TAG_BYTES + " bytes.");
            }
        }
    }

    /**
     * A principal is opaque, but it must at least be printable and fit the owner column.
     */
    public void validatePrincipal(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new RegistryException(RegistryError.INVALID_PARAMETERS, "Principal must not be empty.");
        }
        if (principal.length() > MAX_PRINCIPAL_LENGTH) {
            throw new RegistryException(RegistryError.INVALID_PARAMETERS, "Principal too long.");
        }
        // forbid whitespace and control chars
        if (principal.chars().anyMatch(ch -> ch <= 32 || ch == 127)) {
            throw new RegistryException(RegistryError.INVALID_PARAMETERS,
                    "Principal contains forbidden characters.");
        }
    }

    private static int byteLength(String s) {
        return s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length;
    }
}

package ee.taltech.assetregistry.access;

import ee.taltech.assetregistry.model.AssetRecord;

import java.util.List;

/**
 * Detached copy of an asset record as returned to readers.
 */
public record AssetInfo(
        long assetId,
        String name,
        String owner,
        long sizeBytes,
        long createdAt,
        String description,
        List<String> tags
) {

    public static AssetInfo of(AssetRecord record) {
        return new AssetInfo(
                record.getAssetId(),
                record.getName(),
                record.getOwner(),
                record.getSizeBytes(),
                record.getCreatedAt(),
                record.getDescription(),
                List.copyOf(record.getTags())
        );
    }
}

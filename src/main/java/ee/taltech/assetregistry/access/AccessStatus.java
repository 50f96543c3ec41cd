package ee.taltech.assetregistry.access;

public record AccessStatus(boolean hasGrantedAccess, boolean isAssetOwner, boolean canReadAsset) {

    public static AccessStatus of(boolean hasGrantedAccess, boolean isAssetOwner) {
        return new AccessStatus(hasGrantedAccess, isAssetOwner, hasGrantedAccess || isAssetOwner);
    }
}

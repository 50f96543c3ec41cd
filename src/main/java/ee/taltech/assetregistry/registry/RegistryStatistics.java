package ee.taltech.assetregistry.registry;

/**
 * @param totalAssetsRegistered cumulative creations; deletions do not lower it
 * @param systemAdministrator   identity captured when the registry was initialized
 */
public record RegistryStatistics(long totalAssetsRegistered, String systemAdministrator) {

}

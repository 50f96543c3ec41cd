package ee.taltech.assetregistry.chain;

/**
 * Source of the host's current sequence number (block height).
 */
public interface BlockHeightProvider {

    long currentHeight();
}

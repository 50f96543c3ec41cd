package ee.taltech.assetregistry.chain;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process block counter for running the registry without a host chain.
 * The CLI advances it once per submitted command.
 */
@Component
public class LocalBlockHeightProvider implements BlockHeightProvider {

    private final AtomicLong height;

    public LocalBlockHeightProvider(@Value("${assetregistry.genesis-height:1}") long genesisHeight) {
        if (genesisHeight < 0) {
            throw new IllegalArgumentException("Genesis height cannot be negative.");
        }
        this.height = new AtomicLong(genesisHeight);
    }

    @Override
    public long currentHeight() {
        return height.get();
    }

    public long advance() {
        return height.incrementAndGet();
    }
}

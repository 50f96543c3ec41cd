package ee.taltech.assetregistry;

import ee.taltech.assetregistry.access.AccessControlService;
import ee.taltech.assetregistry.assets.AssetStore;
import ee.taltech.assetregistry.auth.Session;
import ee.taltech.assetregistry.chain.LocalBlockHeightProvider;
import ee.taltech.assetregistry.db.AccessEntryRepository;
import ee.taltech.assetregistry.db.AssetRecordRepository;
import ee.taltech.assetregistry.db.RegistryStateRepository;
import ee.taltech.assetregistry.log.LoggerService;
import ee.taltech.assetregistry.model.AccessEntry;
import ee.taltech.assetregistry.registry.RegistryService;
import ee.taltech.assetregistry.validate.InputValidator;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * JPA slice with the registry services wired in. Tests run without a surrounding
 * transaction so every service call commits or rolls back on its own.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        AssetStore.class,
        AccessControlService.class,
        RegistryService.class,
        LocalBlockHeightProvider.class,
        InputValidator.class,
        LoggerService.class
})
public abstract class RegistryTestSupport {

    protected static final String ADMIN = "ST1ADMIN";
    protected static final Session ALICE = new Session("ST1ALICE");
    protected static final Session BOB = new Session("ST2BOB");
    protected static final Session CAROL = new Session("ST3CAROL");

    @Autowired
    protected AssetStore assetStore;

    @Autowired
    protected AccessControlService accessControl;

    @Autowired
    protected RegistryService registryService;

    @Autowired
    protected LocalBlockHeightProvider blockHeight;

    @Autowired
    protected LoggerService logger;

    @Autowired
    protected AssetRecordRepository assetRecordRepository;

    @Autowired
    protected AccessEntryRepository accessEntryRepository;

    @Autowired
    protected RegistryStateRepository registryStateRepository;

    @BeforeEach
    void resetRegistry() {
        accessEntryRepository.deleteAll();
        assetRecordRepository.deleteAll();
        registryStateRepository.deleteAll();
        registryService.initialize(ADMIN);
    }

    protected long createDoc(Session owner) {
        return assetStore.createDigitalAsset(owner, "doc", 100, "x", List.of("a"));
    }

    protected List<AccessEntry> entriesFor(long assetId) {
        return accessEntryRepository.findAll().stream()
                .filter(e -> e.getId().getAssetId() == assetId)
                .toList();
    }
}

package ee.taltech.assetregistry.assets;

import ee.taltech.assetregistry.auth.Session;
import ee.taltech.assetregistry.chain.BlockHeightProvider;
import ee.taltech.assetregistry.db.AccessEntryRepository;
import ee.taltech.assetregistry.db.AssetRecordRepository;
import ee.taltech.assetregistry.error.RegistryError;
import ee.taltech.assetregistry.error.RegistryException;
import ee.taltech.assetregistry.log.LoggerService;
import ee.taltech.assetregistry.model.AccessEntry;
import ee.taltech.assetregistry.model.AccessEntryId;
import ee.taltech.assetregistry.model.AssetRecord;
import ee.taltech.assetregistry.model.RegistryState;
import ee.taltech.assetregistry.registry.RegistryService;
import ee.taltech.assetregistry.validate.InputValidator;
import jakarta.transaction.Transactional;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Creation and owner-gated mutation of asset records.
 *
 * <p>Checks run in a fixed order: existence, ownership, fields, tags.
 * Any rejection rolls the whole operation back.
 */
@Service
public class AssetStore {

    private final AssetRecordRepository assetRecordRepository;
    private final AccessEntryRepository accessEntryRepository;
    private final RegistryService registryService;
    private final BlockHeightProvider blockHeight;
    private final InputValidator validator;
    private final LoggerService logger;

    public AssetStore(
            AssetRecordRepository assetRecordRepository,
            AccessEntryRepository accessEntryRepository,
            RegistryService registryService,
            BlockHeightProvider blockHeight,
            InputValidator validator,
            LoggerService logger
    ) {
        this.assetRecordRepository = assetRecordRepository;
        this.accessEntryRepository = accessEntryRepository;
        this.registryService = registryService;
        this.blockHeight = blockHeight;
        this.validator = validator;
        this.logger = logger;
    }

    // ------------------------------ create ------------------------------

    /**
     * Registers a new asset owned by the caller and grants the caller read access.
     *
     * @return the new asset id, one above the previous highest id ever issued
     */
    @Transactional
    public long createDigitalAsset(Session session, String name, long sizeBytes,
                                   String description, List<String> tags) {
        Objects.requireNonNull(session, "session");
        // the caller becomes owner and grantee, so it must pass the same rule as a transfer target
        validator.validatePrincipal(session.principal());
        validator.validateAssetFields(name, sizeBytes, description, tags);

        RegistryState state = registryService.requireState();
        long newId = state.nextAssetId();

        AssetRecord record = new AssetRecord(newId, session.principal(), blockHeight.currentHeight());
        applyFields(record, name, sizeBytes, description, tags);

        assetRecordRepository.save(record);
        accessEntryRepository.save(new AccessEntry(new AccessEntryId(newId, session.principal()), true));

        logger.logAfterCommit("asset_create", session.principal(),
                "asset_id=" + newId + " size_bytes=" + sizeBytes + " created_at=" + record.getCreatedAt());
        return newId;
    }

    // ------------------------------ owner operations ------------------------------

    @Transactional
    public void updateDigitalAsset(Session session, long assetId, String name, long sizeBytes,
                                   String description, List<String> tags) {
        AssetRecord record = findOwnedRecordOrThrow(session, assetId);
        validator.validateAssetFields(name, sizeBytes, description, tags);

        applyFields(record, name, sizeBytes, description, tags);
        assetRecordRepository.save(record);

        logger.logAfterCommit("asset_update", session.principal(), "asset_id=" + assetId + " size_bytes=" + sizeBytes);
    }

    /**
     * Hands the asset to another principal. Access entries are left as they are.
     */
    @Transactional
    public void transferAssetOwnership(Session session, long assetId, String newOwner) {
        AssetRecord record = findOwnedRecordOrThrow(session, assetId);
        validator.validatePrincipal(newOwner);

        record.setOwner(newOwner);
        assetRecordRepository.save(record);

        logger.logAfterCommit("asset_transfer", session.principal(), "asset_id=" + assetId + " new_owner=" + newOwner);
    }

    /**
     * Removes the record for good. The id is never issued again.
     */
    @Transactional
    public void deleteDigitalAsset(Session session, long assetId) {
        AssetRecord record = findOwnedRecordOrThrow(session, assetId);

        assetRecordRepository.delete(record);

        logger.logAfterCommit("asset_delete", session.principal(), "asset_id=" + assetId);
    }

    // ------------------------------ helpers ------------------------------

    public boolean assetExists(long assetId) {
        return assetRecordRepository.existsById(assetId);
    }

    private AssetRecord findOwnedRecordOrThrow(Session session, long assetId) {
        Objects.requireNonNull(session, "session");

        AssetRecord record = assetRecordRepository.findById(assetId)
                .orElseThrow(() -> RegistryException.assetNotFound(assetId));

        if (!record.getOwner().equals(session.principal())) {
            throw new RegistryException(RegistryError.PERMISSION_DENIED,
                    "Only the owner can modify asset " + assetId + ".");
        }
        return record;
    }

    private static void applyFields(AssetRecord record, String name, long sizeBytes,
                                    String description, List<String> tags) {
        record.setName(name);
        record.setSizeBytes(sizeBytes);
        record.setDescription(description);
        record.setTags(tags);
    }
}

package ee.taltech.assetregistry.access;

import ee.taltech.assetregistry.auth.Session;
import ee.taltech.assetregistry.db.AccessEntryRepository;
import ee.taltech.assetregistry.db.AssetRecordRepository;
import ee.taltech.assetregistry.error.RegistryError;
import ee.taltech.assetregistry.error.RegistryException;
import ee.taltech.assetregistry.model.AccessEntry;
import ee.taltech.assetregistry.model.AccessEntryId;
import ee.taltech.assetregistry.model.AssetRecord;
import jakarta.transaction.Transactional;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Read path of the registry. Visibility is ownership merged with the access list.
 * Nothing here writes state.
 */
@Service
public class AccessControlService {

    private final AssetRecordRepository assetRecordRepository;
    private final AccessEntryRepository accessEntryRepository;

    public AccessControlService(AssetRecordRepository assetRecordRepository,
                                AccessEntryRepository accessEntryRepository) {
        this.assetRecordRepository = assetRecordRepository;
        this.accessEntryRepository = accessEntryRepository;
    }

    /**
     * Full record for the owner or any principal holding a read grant.
     */
    @Transactional
    public AssetInfo getAssetInformation(Session session, long assetId) {
        Objects.requireNonNull(session, "session");
        AssetRecord record = findRecordOrThrow(assetId);

        boolean isOwner = record.getOwner().equals(session.principal());
        boolean granted = lookupReadFlag(assetId, session.principal()).orElse(false);

        if (!isOwner && !granted) {
            throw new RegistryException(RegistryError.CONTENT_RESTRICTED,
                    "No read access to asset " + assetId + ".");
        }
        return AssetInfo.of(record);
    }

    /**
     * Open to any caller, for any principal.
     */
    @Transactional
    public AccessStatus verifyAccessStatus(long assetId, String principal) {
        AssetRecord record = findRecordOrThrow(assetId);

        boolean granted = lookupReadFlag(assetId, principal).orElse(false);
        boolean isOwner = record.getOwner().equals(principal);
        return AccessStatus.of(granted, isOwner);
    }

    @Transactional
    public String getAssetOwner(long assetId) {
        return findRecordOrThrow(assetId).getOwner();
    }

    // empty when no entry exists; callers default to false
    private Optional<Boolean> lookupReadFlag(long assetId, String principal) {
        if (principal == null) {
            return Optional.empty();
        }
        return accessEntryRepository.findById(new AccessEntryId(assetId, principal))
                .map(AccessEntry::isReadEnabled);
    }

    private AssetRecord findRecordOrThrow(long assetId) {
        return assetRecordRepository.findById(assetId)
                .orElseThrow(() -> RegistryException.assetNotFound(assetId));
    }
}

package ee.taltech.assetregistry.db;

import ee.taltech.assetregistry.model.AccessEntry;
import ee.taltech.assetregistry.model.AccessEntryId;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AccessEntryRepository extends JpaRepository<AccessEntry, AccessEntryId> {
}

package ee.taltech.assetregistry.db;

import ee.taltech.assetregistry.model.AssetRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AssetRecordRepository extends JpaRepository<AssetRecord, Long> {
}

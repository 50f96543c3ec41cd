package ee.taltech.assetregistry.db;

import ee.taltech.assetregistry.model.RegistryState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RegistryStateRepository extends JpaRepository<RegistryState, Integer> {
}

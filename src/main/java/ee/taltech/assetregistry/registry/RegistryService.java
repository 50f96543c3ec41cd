package ee.taltech.assetregistry.registry;

import ee.taltech.assetregistry.db.RegistryStateRepository;
import ee.taltech.assetregistry.log.LoggerService;
import ee.taltech.assetregistry.model.RegistryState;
import ee.taltech.assetregistry.validate.InputValidator;
import jakarta.transaction.Transactional;
import org.springframework.stereotype.Service;

/**
 * Owns the registry-wide state row: the asset id counter and the administrator.
 */
@Service
public class RegistryService {

    private final RegistryStateRepository registryStateRepository;
    private final InputValidator validator;
    private final LoggerService logger;

    public RegistryService(RegistryStateRepository registryStateRepository,
                           InputValidator validator,
                           LoggerService logger) {
        this.registryStateRepository = registryStateRepository;
        this.validator = validator;
        this.logger = logger;
    }

    /**
     * Records the administrator and a zero counter the first time it runs.
     * Later calls leave the existing state untouched.
     *
     * @return true if this call created the registry state
     */
    @Transactional
    public boolean initialize(String administrator) {
        if (registryStateRepository.existsById(RegistryState.SINGLETON_ID)) {
            return false;
        }

        validator.validatePrincipal(administrator);

        registryStateRepository.save(new RegistryState(administrator));
        logger.logAfterCommit("registry_init", administrator, "");
        return true;
    }

    @Transactional
    public RegistryStatistics getRegistryStatistics() {
        RegistryState state = requireState();
        return new RegistryStatistics(state.getLastAssetId(), state.getAdministrator());
    }

    /**
     * Loads the state row for the current transaction.
     */
    public RegistryState requireState() {
        return registryStateRepository.findById(RegistryState.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Registry is not initialized."));
    }

    @Transactional
    public void healthCheck() {
        registryStateRepository.count();
    }
}

package ee.taltech.assetregistry.registry;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Captures the configured administrator on first start. Runs before the CLI.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RegistryInitializer implements CommandLineRunner {

    private final RegistryService registryService;
    private final String administrator;

    public RegistryInitializer(RegistryService registryService,
                               @Value("${assetregistry.administrator}") String administrator) {
        this.registryService = registryService;
        this.administrator = administrator;
    }

    @Override
    public void run(String... args) {
        registryService.initialize(administrator);
    }
}

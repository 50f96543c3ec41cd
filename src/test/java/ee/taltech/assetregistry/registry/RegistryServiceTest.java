package ee.taltech.assetregistry.registry;

import ee.taltech.assetregistry.RegistryTestSupport;
import ee.taltech.assetregistry.auth.Session;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryServiceTest extends RegistryTestSupport {

    @Test
    void freshRegistryReportsAdministratorAndZero() {
        RegistryStatistics stats = registryService.getRegistryStatistics();

        assertThat(stats.totalAssetsRegistered()).isZero();
        assertThat(stats.systemAdministrator()).isEqualTo(ADMIN);
    }

    @Test
    void secondInitializationKeepsFirstAdministrator() {
        assertThat(registryService.initialize("ST9OTHER")).isFalse();

        assertThat(registryService.getRegistryStatistics().systemAdministrator()).isEqualTo(ADMIN);
    }

    @Test
    void totalCountsCreationsNotLiveAssets() {
        long first = createDoc(ALICE);
        createDoc(ALICE);
        assetStore.deleteDigitalAsset(ALICE, first);

        assertThat(assetRecordRepository.count()).isEqualTo(1L);
        assertThat(registryService.getRegistryStatistics().totalAssetsRegistered()).isEqualTo(2L);
    }

    @Test
    void administratorHasNoOwnerPowers() {
        long id = createDoc(ALICE);
        Session admin = new Session(ADMIN);

        assertThatThrownBy(() -> assetStore.deleteDigitalAsset(admin, id))
                .hasMessageContaining("Only the owner");
        assertThat(assetStore.assetExists(id)).isTrue();
    }

    @Test
    void uninitializedRegistryRefusesWork() {
        registryStateRepository.deleteAll();

        assertThatThrownBy(() -> registryService.getRegistryStatistics())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> assetStore.createDigitalAsset(ALICE, "doc", 1, "x", List.of("a")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(assetRecordRepository.count()).isZero();
    }

    @Test
    void blankSessionIsRejected() {
        assertThatThrownBy(() -> new Session(" ")).isInstanceOf(SecurityException.class);
    }

    @Test
    void healthCheckPassesAgainstLiveDatabase() {
        registryService.healthCheck();
    }
}

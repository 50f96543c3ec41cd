package ee.taltech.assetregistry.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

@Entity
@Table(name = "registry_state")
public class RegistryState {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id;

    // last assigned asset id, 0 before the first creation
    @Column(name = "last_asset_id", nullable = false)
    private long lastAssetId;

    @NotBlank
    @Column(nullable = false, updatable = false, length = 128)
    private String administrator;

    public RegistryState() {
    }

    public RegistryState(String administrator) {
        this.id = SINGLETON_ID;
        this.lastAssetId = 0;
        this.administrator = administrator;
    }

    public Integer getId() {
        return id;
    }

    public long getLastAssetId() {
        return lastAssetId;
    }

    public String getAdministrator() {
        return administrator;
    }

    /**
     * Advances the counter by one and returns the new value.
     */
    public long nextAssetId() {
        lastAssetId = lastAssetId + 1;
        return lastAssetId;
    }
}

package ee.taltech.assetregistry.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

@Embeddable
public class AccessEntryId implements Serializable {

    @Column(name = "asset_id", nullable = false)
    private Long assetId;

    @Column(name = "principal", nullable = false, length = 128)
    private String principal;

    public AccessEntryId() {
    }

    public AccessEntryId(Long assetId, String principal) {
        this.assetId = assetId;
        this.principal = principal;
    }

    public Long getAssetId() {
        return assetId;
    }

    public String getPrincipal() {
        return principal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AccessEntryId other)) return false;
        return Objects.equals(assetId, other.assetId) && Objects.equals(principal, other.principal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assetId, principal);
    }
}

package ee.taltech.assetregistry.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.springframework.data.domain.Persistable;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "asset_records")
public class AssetRecord implements Persistable<Long> {

    // assigned from the registry counter, never generated by the database
    @Id
    @Column(name = "asset_id", nullable = false, updatable = false)
    private Long assetId;

    @NotNull
    @Column(nullable = false, length = 64)
    private String name;

    @NotNull
    @Column(name = "owner_principal", nullable = false, length = 128)
    private String owner;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private long createdAt;

    @NotNull
    @Column(nullable = false, length = 128)
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "asset_tags", joinColumns = @JoinColumn(name = "asset_id"))
    @OrderColumn(name = "tag_index")
    @Column(name = "tag", nullable = false, length = 32)
    private List<String> tags = new ArrayList<>();

    // a fresh record is always inserted, never merged over an existing row
    @Transient
    private boolean newRecord = true;

    public AssetRecord() {
    }

    public AssetRecord(Long assetId, String owner, long createdAt) {
        this.assetId = assetId;
        this.owner = owner;
        this.createdAt = createdAt;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newRecord = false;
    }

    @Override
    public Long getId() {
        return assetId;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }

    // ------------------------------ getters ------------------------------

    public Long getAssetId() {
        return assetId;
    }

    public String getName() {
        return name;
    }

    public String getOwner() {
        return owner;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    // ------------------------------ setters for mutable fields ------------------------------

    public void setName(String name) {
        this.name = name;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public void setSizeBytes(long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public void setTags(List<String> tags) {
        this.tags.clear();
        this.tags.addAll(tags);
    }
}

package ee.taltech.assetregistry.model;

import jakarta.persistence.*;

/**
 * Read permission of one principal on one asset.
 * A missing row means no access.
 */
@Entity
@Table(name = "access_entries")
public class AccessEntry {

    @EmbeddedId
    private AccessEntryId id;

    @Column(name = "read_enabled", nullable = false)
    private boolean readEnabled;

    public AccessEntry() {
    }

    public AccessEntry(AccessEntryId id, boolean readEnabled) {
        this.id = id;
        this.readEnabled = readEnabled;
    }

    public AccessEntryId getId() {
        return id;
    }

    public boolean isReadEnabled() {
        return readEnabled;
    }

    public void setReadEnabled(boolean readEnabled) {
        this.readEnabled = readEnabled;
    }
}

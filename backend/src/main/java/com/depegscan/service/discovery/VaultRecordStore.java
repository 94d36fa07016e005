package com.depegscan.service.discovery;

import com.depegscan.model.VaultKey;
import com.depegscan.model.VaultRecord;

import java.util.List;

/**
 * Accumulates vault records across discovery phases. Implementations must be safe for
 * concurrent writers; the first record stored for a key wins.
 */
public interface VaultRecordStore {

    /**
     * @return true if the record was stored, false if the key was already present
     */
    boolean putIfAbsent(VaultRecord record);

    boolean contains(VaultKey key);

    /** Snapshot ordered by key. */
    List<VaultRecord> all();

    int size();
}

package com.depegscan.service.discovery;

import com.depegscan.model.VaultKey;
import com.depegscan.model.VaultRecord;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Run-scoped store backed by a concurrent map. */
public class InMemoryVaultRecordStore implements VaultRecordStore {

    private final ConcurrentMap<VaultKey, VaultRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean putIfAbsent(VaultRecord record) {
        return records.putIfAbsent(record.key(), record) == null;
    }

    @Override
    public boolean contains(VaultKey key) {
        return records.containsKey(key);
    }

    @Override
    public List<VaultRecord> all() {
        return records.values().stream()
                .sorted(Comparator.comparing(VaultRecord::key))
                .toList();
    }

    @Override
    public int size() {
        return records.size();
    }
}

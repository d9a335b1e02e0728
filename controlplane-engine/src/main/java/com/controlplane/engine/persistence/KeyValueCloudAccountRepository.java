package com.controlplane.engine.persistence;

import com.controlplane.core.model.CloudAccount;
import com.controlplane.core.repository.CloudAccountRepository;
import com.controlplane.core.repository.KeyValueStore;

import java.util.Optional;

/**
 * CloudAccountRepository over the key-value store under {@value #PREFIX}.
 */
public class KeyValueCloudAccountRepository implements CloudAccountRepository {

    public static final String PREFIX = "/cloudaccount/";

    private final KeyValueStore store;
    private final JsonCodec codec;

    public KeyValueCloudAccountRepository(KeyValueStore store, JsonCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public Optional<CloudAccount> findByName(String name) {
        return store.get(PREFIX, name)
            .map(entry -> codec.decode(entry.value(), CloudAccount.class));
    }

    @Override
    public void save(CloudAccount account) {
        store.put(PREFIX, account.name(), codec.encode(account));
    }
}

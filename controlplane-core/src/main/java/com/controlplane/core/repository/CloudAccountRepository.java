package com.controlplane.core.repository;

import com.controlplane.core.model.CloudAccount;

import java.util.Optional;

/**
 * Source of cloud account credentials.
 */
public interface CloudAccountRepository {

    Optional<CloudAccount> findByName(String name);

    void save(CloudAccount account);
}

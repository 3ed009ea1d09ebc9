package com.tierflow.core.repository;

import java.util.List;
import java.util.Optional;

/**
 * Read access to clients for the metrics export. Owned by the business layer; the
 * orchestrator only reads through it.
 */
public interface ClientRepository {

    Client save(Client client);

    Optional<Client> findById(String id);

    List<Client> findAll();

    long count();
}

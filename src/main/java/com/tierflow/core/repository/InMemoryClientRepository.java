package com.tierflow.core.repository;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryClientRepository implements ClientRepository {

    private final ConcurrentHashMap<String, Client> clients = new ConcurrentHashMap<>();

    @Override
    public Client save(Client client) {
        clients.put(client.id(), client);
        return client;
    }

    @Override
    public Optional<Client> findById(String id) {
        return Optional.ofNullable(clients.get(id));
    }

    @Override
    public List<Client> findAll() {
        return new ArrayList<>(clients.values());
    }

    @Override
    public long count() {
        return clients.size();
    }
}

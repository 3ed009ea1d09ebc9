package com.tierflow.core.repository;

import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryCampaignRepository implements CampaignRepository {

    private final ConcurrentHashMap<String, Campaign> campaigns = new ConcurrentHashMap<>();

    @Override
    public Campaign save(Campaign campaign) {
        campaigns.put(campaign.id(), campaign);
        return campaign;
    }

    @Override
    public Optional<Campaign> findById(String id) {
        return Optional.ofNullable(campaigns.get(id));
    }

    @Override
    public List<Campaign> findAll() {
        return new ArrayList<>(campaigns.values());
    }

    @Override
    public long count() {
        return campaigns.size();
    }
}

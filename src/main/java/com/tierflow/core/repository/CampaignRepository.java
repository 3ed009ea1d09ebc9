package com.tierflow.core.repository;

import java.util.List;
import java.util.Optional;

/**
 * Read access to campaigns for the metrics export.
 */
public interface CampaignRepository {

    Campaign save(Campaign campaign);

    Optional<Campaign> findById(String id);

    List<Campaign> findAll();

    long count();
}

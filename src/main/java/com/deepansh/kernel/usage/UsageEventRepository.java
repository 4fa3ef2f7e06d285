package com.deepansh.kernel.usage;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface UsageEventRepository extends MongoRepository<UsageEvent, String> {

    List<UsageEvent> findByAgentIdOrderByCreatedAtDesc(String agentId);

    @Aggregation(pipeline = {
        "{ $match: { 'agentId': ?0, 'createdAt': { $gte: ?1 } } }",
        "{ $group: { _id: null, total: { $sum: '$costEstimateUsd' } } }"
    })
    Double totalCostSince(String agentId, Instant since);
}

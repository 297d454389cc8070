package com.flagship.settlement_engine.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, ProcessedEventKey> {

    List<ProcessedEventEntity> findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(String aggregateType, UUID aggregateId);
}

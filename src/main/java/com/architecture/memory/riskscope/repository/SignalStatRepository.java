package com.architecture.memory.riskscope.repository;

import com.architecture.memory.riskscope.model.SignalStat;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SignalStatRepository extends MongoRepository<SignalStat, String> {

    /**
     * Find signals currently switched off
     */
    List<SignalStat> findByEnabled(boolean enabled);
}

package com.architecture.memory.riskscope.repository;

import com.architecture.memory.riskscope.model.FeedbackEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FeedbackEventRepository extends MongoRepository<FeedbackEvent, String> {

    List<FeedbackEvent> findBySignalNameOrderByRecordedAtDesc(String signalName);
}

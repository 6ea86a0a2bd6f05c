package com.architecture.memory.riskscope.service.validation;

import com.architecture.memory.riskscope.model.FeedbackEvent;
import com.architecture.memory.riskscope.model.SignalStat;
import com.architecture.memory.riskscope.repository.FeedbackEventRepository;
import com.architecture.memory.riskscope.repository.SignalStatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB-backed {@link SignalStatStore}. Counter changes go through findAndModify with $inc,
 * so concurrent feedback on the same signal never loses an update.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoSignalStatStore implements SignalStatStore {

    private final MongoTemplate mongoTemplate;
    private final SignalStatRepository signalStatRepository;
    private final FeedbackEventRepository feedbackEventRepository;
    private final Clock clock;

    @Override
    public SignalStat increment(String name, boolean falsePositive) {
        Update update = new Update()
                .inc("totalUses", 1)
                .inc(falsePositive ? "falsePositives" : "truePositives", 1)
                .set("updatedAt", clock.instant())
                .setOnInsert("enabled", true);
        try {
            return mongoTemplate.findAndModify(
                    byName(name),
                    update,
                    FindAndModifyOptions.options().returnNew(true).upsert(true),
                    SignalStat.class);
        } catch (DataAccessException e) {
            throw new ValidatorWriteException("Failed to increment stats for signal " + name, e);
        }
    }

    @Override
    public void updateRate(String name, long observedTotalUses, double fpRate) {
        Query query = byName(name).addCriteria(Criteria.where("totalUses").is(observedTotalUses));
        try {
            long modified = mongoTemplate.updateFirst(query, Update.update("fpRate", fpRate), SignalStat.class)
                    .getModifiedCount();
            if (modified == 0) {
                log.debug("[Validator] fp_rate for {} already superseded (observed totalUses={})", name, observedTotalUses);
            }
        } catch (DataAccessException e) {
            throw new ValidatorWriteException("Failed to update fp_rate for signal " + name, e);
        }
    }

    @Override
    public boolean disable(String name, String reason) {
        Query query = byName(name).addCriteria(Criteria.where("enabled").is(true));
        Update update = new Update()
                .set("enabled", false)
                .set("disabledReason", reason)
                .set("disabledAt", clock.instant());
        try {
            return mongoTemplate.updateFirst(query, update, SignalStat.class).getModifiedCount() > 0;
        } catch (DataAccessException e) {
            throw new ValidatorWriteException("Failed to disable signal " + name, e);
        }
    }

    @Override
    public SignalStat enable(String name) {
        Update update = new Update()
                .set("enabled", true)
                .unset("disabledReason")
                .unset("disabledAt")
                .set("updatedAt", clock.instant());
        try {
            return mongoTemplate.findAndModify(
                    byName(name),
                    update,
                    FindAndModifyOptions.options().returnNew(true).upsert(true),
                    SignalStat.class);
        } catch (DataAccessException e) {
            throw new ValidatorWriteException("Failed to enable signal " + name, e);
        }
    }

    @Override
    public Optional<SignalStat> find(String name) {
        try {
            return signalStatRepository.findById(name);
        } catch (DataAccessException e) {
            throw new ValidatorWriteException("Failed to read stats for signal " + name, e);
        }
    }

    @Override
    public List<SignalStat> findAll() {
        try {
            return signalStatRepository.findAll();
        } catch (DataAccessException e) {
            throw new ValidatorWriteException("Failed to read signal stats", e);
        }
    }

    @Override
    public void recordEvent(FeedbackEvent event) {
        try {
            feedbackEventRepository.save(event);
        } catch (DataAccessException e) {
            throw new ValidatorWriteException("Failed to append feedback event for " + event.getSignalName(), e);
        }
    }

    private static Query byName(String name) {
        return Query.query(Criteria.where("_id").is(name));
    }
}

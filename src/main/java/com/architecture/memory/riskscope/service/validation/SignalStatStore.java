package com.architecture.memory.riskscope.service.validation;

import com.architecture.memory.riskscope.model.FeedbackEvent;
import com.architecture.memory.riskscope.model.SignalStat;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for {@link SignalStat} rows. Implementations must make
 * {@link #increment} atomic per signal.
 *
 * <p>Failures surface as {@link ValidatorWriteException}.</p>
 */
public interface SignalStatStore {

    /**
     * Atomically adds one use and one false or true positive, creating the row if needed.
     *
     * @return the row as it is right after this increment
     */
    SignalStat increment(String name, boolean falsePositive);

    /**
     * Writes fp_rate unless a writer that saw a later totalUses already did.
     */
    void updateRate(String name, long observedTotalUses, double fpRate);

    /**
     * @return true if this call flipped the signal from enabled to disabled
     */
    boolean disable(String name, String reason);

    SignalStat enable(String name);

    Optional<SignalStat> find(String name);

    List<SignalStat> findAll();

    /**
     * Appends to the feedback audit log.
     */
    void recordEvent(FeedbackEvent event);
}

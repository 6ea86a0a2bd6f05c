package com.architecture.memory.riskscope.service.signal.profile;

import lombok.Builder;
import lombok.Value;

/**
 * Which profile applies to a file, and why.
 */
@Value
@Builder
public class ProfileSelection {

    RiskProfile profile;
    String language;
    ProjectDomain domain;
    String reason;
    boolean fallbackUsed;
}

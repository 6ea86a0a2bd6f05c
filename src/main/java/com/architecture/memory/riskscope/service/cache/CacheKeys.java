package com.architecture.memory.riskscope.service.cache;

import com.architecture.memory.riskscope.dto.risk.SignalName;

public final class CacheKeys {

    private CacheKeys() {
    }

    public static String signal(SignalName name, String filePath) {
        return "signal:" + name.getWireName() + ":" + filePath;
    }

    public static String trace(String investigationId) {
        return "trace:" + investigationId;
    }
}

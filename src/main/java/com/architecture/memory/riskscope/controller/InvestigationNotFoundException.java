package com.architecture.memory.riskscope.controller;

public class InvestigationNotFoundException extends RuntimeException {

    public InvestigationNotFoundException(String investigationId) {
        super("No investigation trace for id " + investigationId + " (unknown or expired)");
    }
}

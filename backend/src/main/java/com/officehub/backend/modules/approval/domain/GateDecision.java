package com.officehub.backend.modules.approval.domain;

public record GateDecision(boolean allowed, String denialCode) {

    private static final GateDecision ALLOW = new GateDecision(true, null);

    public static GateDecision allow() {
        return ALLOW;
    }

    public static GateDecision deny(String denialCode) {
        return new GateDecision(false, denialCode);
    }
}

package com.flagship.settlement_engine.common.actor;

public enum ActorRole {
    BUYER,
    ORGANIZER,
    ADMIN
}

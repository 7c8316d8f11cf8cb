package com.ias.distributor.entity;

/**
 * Audit event types
 */
public enum SettlementEventType {
    REWARD_DISTRIBUTED,
    BATCH_REWARD_DISTRIBUTED,
    REWARD_CLAIMED,
    EMERGENCY_WITHDRAWAL,
    LEDGER_FUNDED,
    ASSET_REFERENCE_UPDATED,
    AUTHORITY_TRANSFERRED
}

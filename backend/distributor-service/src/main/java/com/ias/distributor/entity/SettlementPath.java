package com.ias.distributor.entity;

/**
 * Which distribution path settled an (affiliate, epoch) pair
 */
public enum SettlementPath {
    BATCH,
    CLAIM
}

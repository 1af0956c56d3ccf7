package com.licenseguard.api.subscription.models;

/**
 * Closed set of plans a license can derive its features from.
 */
public enum PlanTier {
    TRIAL,
    BASIC,
    PRO,
}

package com.taleforge.core.model;

/**
 * Content rating configured for a campaign.
 */
public enum ContentRating {
    G,
    PG,
    PG13,
    R,
    NC17
}

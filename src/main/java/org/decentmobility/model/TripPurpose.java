package org.decentmobility.model;

/**
 * Purpose classifying a mobility need.
 */
public enum TripPurpose {
    COMMUTE,
    OTHER
}

package org.decentmobility.persona;

/**
 * Purpose a visited place serves, used to count trips against per-purpose needs.
 */
public enum Purpose {
    WORK,
    LEISURE
}

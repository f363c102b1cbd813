package org.decentmobility.model;

/**
 * Category used to index an agent's location mapping.
 */
public enum LocationRole {
    HOME,
    WORK
}

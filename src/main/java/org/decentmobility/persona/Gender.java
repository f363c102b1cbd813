package org.decentmobility.persona;

/**
 * Coded personal characteristic used for persona membership.
 */
public enum Gender {
    /** Women, lesbian, intersex, non-binary, trans and agender people. */
    FLINT,
    MALE
}

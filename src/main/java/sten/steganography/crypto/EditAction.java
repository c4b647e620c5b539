package sten.steganography.crypto;

/**
 * Kind of a single edit made to a key while it is being entered.
 */
public enum EditAction {
    INSERT,
    DELETE
}

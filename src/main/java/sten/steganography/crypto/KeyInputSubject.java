package sten.steganography.crypto;

/**
 * What a key validator is shown for an edit.
 */
public enum KeyInputSubject {
    /** Only the characters being inserted or deleted. */
    EDITED_TEXT,
    /** The whole key as it would read after the edit. */
    PROPOSED_VALUE
}

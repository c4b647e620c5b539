package sten.steganography.model;

/**
 * Outcome of hiding a message.
 * @param hiddenCharacters Characters of the (possibly truncated) plaintext that were hidden.
 * @param embeddedCharacters Characters actually written, ciphertext plus delimiter.
 * @param capacity Plaintext capacity of the cover under the plan.
 * @param truncated Whether the message was cut to fit.
 */
public record HideResult(int hiddenCharacters, int embeddedCharacters, int capacity, boolean truncated) {
}

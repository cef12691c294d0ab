package com.layoutparser.generator.collaborator;

/**
 * Turns stored ciphertext into plain text. Implementations fail closed: on any problem
 * they return the input unchanged.
 */
public interface Decryptor {

    String decrypt(String ciphertext);

    static Decryptor identity() {
        return ciphertext -> ciphertext;
    }
}

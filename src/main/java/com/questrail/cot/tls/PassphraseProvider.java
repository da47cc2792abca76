package com.questrail.cot.tls;

import java.util.Optional;

/**
 * Supplies the passphrase for an encrypted private key.
 *
 * <p>Key loading asks for a passphrase only when a key turns out to be encrypted.
 * An empty answer is an error, never a reason to skip the key.</p>
 */
@FunctionalInterface
public interface PassphraseProvider
{
    /**
     * @param resource human-readable name of the encrypted key (usually its path)
     */
    Optional<char[]> passphraseFor(String resource);

    /**
     * Asks {@code this} first and {@code fallback} only if {@code this} has no answer.
     */
    default PassphraseProvider orElse(PassphraseProvider fallback) {
        return resource -> {
            Optional<char[]> first = passphraseFor(resource);
            return first.isPresent() ? first : fallback.passphraseFor(resource);
        };
    }

    static PassphraseProvider none() {
        return resource -> Optional.empty();
    }
}

package com.questrail.cot.tls;

import java.util.Optional;

/**
 * Returns a passphrase taken from configuration, for every key.
 */
public final class ConfiguredPassphraseProvider implements PassphraseProvider
{
    private final String passphrase;

    /**
     * @param passphrase may be {@code null}, in which case no answer is given
     */
    public ConfiguredPassphraseProvider(String passphrase) {
        this.passphrase = passphrase;
    }

    @Override
    public Optional<char[]> passphraseFor(String resource) {
        return passphrase == null ? Optional.empty() : Optional.of(passphrase.toCharArray());
    }
}

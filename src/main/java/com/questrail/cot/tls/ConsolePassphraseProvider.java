package com.questrail.cot.tls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Console;
import java.util.Optional;

/**
 * Prompts on the controlling terminal. Gives no answer when the process has none.
 */
public final class ConsolePassphraseProvider implements PassphraseProvider
{
    private static final Logger log = LoggerFactory.getLogger(ConsolePassphraseProvider.class);

    @Override
    public Optional<char[]> passphraseFor(String resource) {
        Console console = System.console();
        if (console == null) {
            log.debug("No console available to prompt for the passphrase of {}", resource);
            return Optional.empty();
        }
        char[] entered = console.readPassword("Passphrase for %s: ", resource);
        return entered == null ? Optional.empty() : Optional.of(entered);
    }
}

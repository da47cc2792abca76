package com.questrail.cot.prefs;

import com.questrail.cot.config.ConfigKeys;
import com.questrail.cot.config.CotClientConfig;
import com.questrail.cot.tls.TlsIdentity;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of importing a preference package.
 *
 * <p>{@code settings} use the client configuration keys; certificate paths in it are
 * absolute and point into {@code workingDirectory}, which stays on disk after the
 * import so TLS setup can read them.</p>
 */
public record ImportedPreferences(Map<String, String> settings, Path workingDirectory)
{
    public ImportedPreferences {
        settings = Map.copyOf(settings);
        Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    /**
     * The TLS identity described by the package alone, if it names a client
     * certificate.
     */
    public Optional<TlsIdentity> tlsIdentity() {
        if (!settings.containsKey(ConfigKeys.TLS_CLIENT_CERT)) {
            return Optional.empty();
        }
        return Optional.of(TlsIdentity.fromConfig(CotClientConfig.fromMap(settings)));
    }

    /**
     * Fills every key {@code config} leaves unset with the package's value. Explicit
     * settings in {@code config} always win.
     */
    public CotClientConfig mergeInto(CotClientConfig config) {
        return config.withDefaults(settings);
    }
}

package com.questrail.cot.prefs;

import com.questrail.cot.CotClientException;

/**
 * A preference package could not be opened, extracted or understood.
 */
public final class PreferencePackageException extends CotClientException
{
    public PreferencePackageException(String message) {
        super(message);
    }

    public PreferencePackageException(String message, Throwable cause) {
        super(message, cause);
    }
}

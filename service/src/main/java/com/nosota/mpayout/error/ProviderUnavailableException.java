package com.nosota.mpayout.error;

public class ProviderUnavailableException extends Exception {
    public ProviderUnavailableException() {
    }

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProviderUnavailableException(Throwable cause) {
        super(cause);
    }
}

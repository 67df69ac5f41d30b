package io.github.riemr.pto.application.exception;

public class HolidayProviderException extends RuntimeException {
    private final boolean notFound;

    public HolidayProviderException(String message, boolean notFound) {
        super(message);
        this.notFound = notFound;
    }

    public HolidayProviderException(String message, Throwable cause) {
        super(message, cause);
        this.notFound = false;
    }

    /** The provider has no data for the requested country/year. */
    public boolean isNotFound() {
        return notFound;
    }
}

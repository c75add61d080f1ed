package tech.noetzold.devpulse_api.service;

public class UpstreamUnavailableException extends RuntimeException {

    private final String source;

    public UpstreamUnavailableException(String source, Throwable cause) {
        super(source + " unavailable: " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}

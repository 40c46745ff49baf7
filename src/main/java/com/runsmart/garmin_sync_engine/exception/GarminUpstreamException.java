package com.runsmart.garmin_sync_engine.exception;

import java.util.regex.Pattern;

/**
 * Non-2xx response (or transport failure, status 0) from a Garmin endpoint.
 */
public class GarminUpstreamException extends RuntimeException {

    private static final Pattern TOKEN_PROBLEM = Pattern.compile(
            "unable to read oauth header|invalid[_ ]token|expired|unauthorized", Pattern.CASE_INSENSITIVE);

    private final int status;
    private final String body;
    private final String source;

    public GarminUpstreamException(String source, int status, String body) {
        super(source + " returned " + status + summarize(body));
        this.source = source;
        this.status = status;
        this.body = body;
    }

    public GarminUpstreamException(String source, String message, Throwable cause) {
        super(source + " request failed: " + message, cause);
        this.source = source;
        this.status = 0;
        this.body = null;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public String getSource() {
        return source;
    }

    public boolean isServerError() {
        return status >= 500 || status == 0;
    }

    public boolean isAuthFailure() {
        if (status == 401) {
            return true;
        }
        return status == 403 && body != null && TOKEN_PROBLEM.matcher(body).find();
    }

    private static String summarize(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.trim();
        return ": " + (trimmed.length() > 200 ? trimmed.substring(0, 200) : trimmed);
    }
}

package com.outagesentinel.detector.probe;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

final class FailureDetails {
    private FailureDetails() {
    }

    static String describe(Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (root instanceof TimeoutException || root instanceof HttpTimeoutException || lowered.contains("timed out")) {
            return "timeout";
        }
        if (root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("nodename")) {
            return "unknown_host: " + rootText;
        }
        if (root instanceof ConnectException) {
            return "connection_refused";
        }
        return root.getClass().getSimpleName() + ": " + rootText;
    }

    static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}

package com.example.media_acquisition.service.backend;

import com.example.media_acquisition.exception.BackendException;
import com.example.media_acquisition.exception.PoolExhaustedException;
import com.example.media_acquisition.exception.ToolUnavailableException;
import com.example.media_acquisition.util.BackendErrorClass;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Stock classifiers for subprocess-based and HTTP-based backends.
 */
public final class ErrorClassifiers {

    private ErrorClassifiers() {
    }

    public static ErrorClassifier process() {
        return ErrorClassifiers::classifyProcessError;
    }

    public static ErrorClassifier http() {
        return ErrorClassifiers::classifyHttpError;
    }

    public static boolean isAuthWall(String output) {
        if (output == null) {
            return false;
        }
        String normalized = output.toLowerCase(Locale.ROOT)
                .replace('’', '\'');
        return normalized.contains("sign in to confirm you're not a bot")
                || normalized.contains("--cookies-from-browser")
                || normalized.contains("use --cookies")
                || normalized.contains("not a bot")
                || normalized.contains("bot detection")
                || normalized.contains("login required");
    }

    /**
     * True only when the remote API answered 403 or 429 to the call made with the leased credential.
     * Failures a backend wraps in a {@link BackendException}, such as a throttled media download, do not
     * count against the credential.
     */
    public static boolean isCredentialRejection(Throwable error) {
        if (error instanceof WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            return status == 403 || status == 429;
        }
        return false;
    }

    static BackendErrorClass classifyProcessError(Throwable error) {
        BackendErrorClass explicit = explicitClass(error);
        if (explicit != null) {
            return explicit;
        }
        if (error instanceof ToolUnavailableException) {
            return BackendErrorClass.FATAL;
        }
        if (error instanceof TimeoutException) {
            return BackendErrorClass.TRANSIENT;
        }
        String msg = messages(error);
        if (isAuthWall(msg)) {
            return BackendErrorClass.BOT_DETECTED;
        }
        if (msg.contains("http error 429") || msg.contains("too many requests") || msg.contains("rate limit")
                || msg.contains("rate-limit")) {
            return BackendErrorClass.RATE_LIMITED;
        }
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")
                || msg.contains("temporary failure") || msg.contains("unable to download webpage")) {
            return BackendErrorClass.TRANSIENT;
        }
        return BackendErrorClass.FATAL;
    }

    static BackendErrorClass classifyHttpError(Throwable error) {
        BackendErrorClass explicit = explicitClass(error);
        if (explicit != null) {
            return explicit;
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof WebClientResponseException ex) {
                int status = ex.getStatusCode().value();
                if (status == 429 || status == 403) {
                    return BackendErrorClass.RATE_LIMITED;
                }
                if (ex.getStatusCode().is5xxServerError()) {
                    return BackendErrorClass.TRANSIENT;
                }
                return BackendErrorClass.FATAL;
            }
            if (t instanceof WebClientRequestException || t instanceof TimeoutException || t instanceof IOException) {
                return BackendErrorClass.TRANSIENT;
            }
        }
        return classifyProcessError(error);
    }

    private static BackendErrorClass explicitClass(Throwable error) {
        if (error instanceof PoolExhaustedException) {
            return BackendErrorClass.POOL_EXHAUSTED;
        }
        if (error instanceof BackendException be && be.getClassification() != null) {
            return be.getClassification();
        }
        return null;
    }

    private static String messages(Throwable error) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                sb.append(t.getMessage()).append('\n');
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT).replace('’', '\'');
    }
}

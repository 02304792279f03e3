package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.Callback;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.CancellationException;
import java.util.regex.Pattern;

/**
 * Various utility functions
 */
final class CFUtil {
    static final String USER_AGENT_HEADER_VALUE =
            CFPackageConsts.SDK_CLIENT_NAME + "/" + CFPackageConsts.SDK_VERSION;

    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    private static final Pattern UNSAFE_KEY_CHARS = Pattern.compile("[^a-zA-Z0-9_]");

    private CFUtil() {
    }

    static <T> Callback<T> noOpCallback() {
        return new Callback<T>() {
            @Override
            public void onSuccess(T result) {
            }

            @Override
            public void onError(Throwable error) {
            }
        };
    }

    /**
     * Formats a timestamp the way the CustomFit analytics endpoints expect it.
     *
     * @param epochMillis milliseconds since the epoch
     * @return e.g. "2024-03-01 12:00:00.000Z"
     */
    static String formatTimestamp(long epochMillis) {
        return TIMESTAMP_FORMATTER.format(Instant.ofEpochMilli(epochMillis));
    }

    /**
     * Replaces every character that is not a letter, digit, or underscore, so that the result is
     * usable as a key in any backing store.
     *
     * @param key the raw key
     * @return the normalized key
     */
    static String normalizeKey(String key) {
        return UNSAFE_KEY_CHARS.matcher(key).replaceAll("_");
    }

    static boolean isNullOrBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    static String urlSafeBase64Hash(String input) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("SHA-256");
            byte[] hash = messageDigest.digest(input.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e); // shouldn't be possible; SHA-256 is built in
        }
    }

    /**
     * Tests whether an HTTP error status represents a condition that might resolve on its own if we retry.
     * @param statusCode the HTTP status
     * @return true if retrying makes sense; false if it should be considered a permanent failure
     */
    static boolean isHttpErrorRecoverable(int statusCode) {
        if (statusCode >= 400 && statusCode < 500) {
            switch (statusCode) {
                case 400: // bad request
                case 408: // request timeout
                case 429: // too many requests
                    return true;
                default:
                    return false; // all other 4xx errors are unrecoverable
            }
        }
        return true;
    }

    /**
     * Returns true if the error, or anything in its cause chain, means the work was cancelled.
     * Cancelled work is never retried.
     *
     * @param e an error
     * @return true if this is a cancellation
     */
    static boolean isCancellation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException || t instanceof CancellationException
                    || t instanceof InterruptedIOException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    static void logExceptionAtErrorLevel(LDLogger logger, Throwable ex, String msgFormat, Object... msgArgs) {
        logException(logger, ex, true, msgFormat, msgArgs);
    }

    static void logExceptionAtWarnLevel(LDLogger logger, Throwable ex, String msgFormat, Object... msgArgs) {
        logException(logger, ex, false, msgFormat, msgArgs);
    }

    private static void logException(LDLogger logger, Throwable ex, boolean asError, String msgFormat, Object... msgArgs) {
        String addFormat = msgFormat + " - {}";
        Object exSummary = LogValues.exceptionSummary(ex);
        Object[] args = Arrays.copyOf(msgArgs, msgArgs.length + 1);
        args[msgArgs.length] = exSummary;
        if (asError) {
            logger.error(addFormat, args);
        } else {
            logger.warn(addFormat, args);
        }
        logger.debug(LogValues.exceptionTrace(ex));
    }
}

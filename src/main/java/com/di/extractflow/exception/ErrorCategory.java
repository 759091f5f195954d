package com.di.extractflow.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Standardized error categories for logging, REST error bodies and alerting.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and optionally add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    INVARIANT_VIOLATION("Invariant violation", "A structural guarantee of the pipeline does not hold; fatal to the step"),
    SUBPROCESS_FAILURE("Subprocess failure", "A domain binary exited with a non-zero status"),
    TRANSIENT_IO("Transient I/O error", "Object storage or file transfer failure local to one unit of work"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    AUTHENTICATION_ERROR("Authentication error", "Authentication or authorization failure"),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. Add new categories before APPLICATION_ERROR. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof InvariantViolationException, INVARIANT_VIOLATION);
        MATCHERS.put(t -> t instanceof SubprocessFailedException, SUBPROCESS_FAILURE);
        MATCHERS.put(ErrorCategory::isTransientIo, TRANSIENT_IO);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationError, AUTHENTICATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        Throwable t = unwrap(exception);
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(t)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /** Step and future wrappers are categorized by what they wrap. */
    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof StepExecutionException
                || current instanceof ExecutionException
                || current instanceof CompletionException)
                && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    // --- Matcher helpers (add new ones here when adding categories) ---

    private static boolean isTransientIo(Throwable t) {
        return t instanceof ObjectStorageException
                || t instanceof ParallelPhaseException
                || t instanceof java.io.UncheckedIOException
                || t instanceof com.google.cloud.BaseServiceException;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || (t instanceof java.io.IOException && !(t instanceof java.io.FileNotFoundException)
                    && !(t instanceof java.nio.file.FileSystemException));
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.beans.factory.BeanDefinitionStoreException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.FileSystemException;
    }

    private static boolean isAuthenticationError(Throwable t) {
        if (messageContains(t, "authentication", "unauthorized", "forbidden", "access denied", "invalid credentials")) {
            return true;
        }
        String cn = t.getClass().getName();
        return cn.contains("AuthenticationException") || cn.contains("AccessDeniedException");
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof java.io.NotSerializableException
                || t instanceof java.io.StreamCorruptedException
                || t instanceof java.util.zip.ZipException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}

package com.catalogsync.worldcat.job;

import com.catalogsync.domain.RecordOperation;
import com.catalogsync.file.MissingColumnException;
import com.catalogsync.worldcat.adapter.ConnectionFailureException;
import com.catalogsync.worldcat.adapter.HttpStatusException;
import com.catalogsync.worldcat.auth.AuthExpiredException;
import com.catalogsync.worldcat.auth.TokenRequestException;

import java.util.List;

/**
 * A processing failure as data. Fatal failures halt the run after they have been recorded.
 */
public record Failure(FailureScope scope, boolean fatal, Stage stage, String message, Throwable cause) {

    private static final List<Class<? extends RuntimeException>> FATAL_TYPES = List.of(
            HttpStatusException.class,
            ConnectionFailureException.class,
            AuthExpiredException.class,
            TokenRequestException.class,
            MissingColumnException.class);

    public static Failure of(FailureScope scope, Stage stage, Throwable cause) {
        return new Failure(scope, isFatal(cause), stage, String.valueOf(cause.getMessage()), cause);
    }

    /** Batch-level failure for buffered identifiers the API response left without an entry. */
    public static Failure unanswered(RecordOperation operation) {
        return new Failure(FailureScope.BATCH_LEVEL, false, Stage.CLASSIFICATION,
                "no result returned by " + operation.getApiName() + " for this record", null);
    }

    public static boolean isFatal(Throwable cause) {
        return FATAL_TYPES.stream().anyMatch(type -> type.isInstance(cause));
    }

    /** Message written to error rows. */
    public String describe() {
        return stage.getLabel() + " failed: " + message;
    }
}

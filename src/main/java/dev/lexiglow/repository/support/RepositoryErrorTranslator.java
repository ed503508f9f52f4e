package dev.lexiglow.repository.support;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoTimeoutException;
import dev.lexiglow.exception.ConflictException;
import dev.lexiglow.exception.PersistenceException;
import dev.lexiglow.exception.RepositoryTimeoutException;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcTimeoutException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

import java.util.concurrent.TimeoutException;

/**
 * Maps backend-native and Spring data-access errors onto the persistence error taxonomy.
 */
public final class RepositoryErrorTranslator {

    /** SQL state for unique constraint violations. */
    static final String UNIQUE_VIOLATION = "23505";

    private RepositoryErrorTranslator() {
    }

    public static PersistenceException translate(Throwable error, String operation, String entityType, String entityId) {
        if (error instanceof PersistenceException persistenceException) {
            return persistenceException;
        }
        if (isTimeout(error)) {
            return new RepositoryTimeoutException(operation, entityType, entityId, error);
        }
        if (error instanceof DuplicateKeyException) {
            return new ConflictException(ConflictException.Reason.DUPLICATE, operation, entityType, entityId, error);
        }
        if (error instanceof DataIntegrityViolationException || error instanceof R2dbcDataIntegrityViolationException) {
            ConflictException.Reason reason = UNIQUE_VIOLATION.equals(sqlState(error))
                    ? ConflictException.Reason.DUPLICATE
                    : ConflictException.Reason.INTEGRITY;
            return new ConflictException(reason, operation, entityType, entityId, error);
        }
        MongoServerException mongo = findCause(error, MongoServerException.class);
        if (mongo != null && ErrorCategory.fromErrorCode(mongo.getCode()) == ErrorCategory.DUPLICATE_KEY) {
            return new ConflictException(ConflictException.Reason.DUPLICATE, operation, entityType, entityId, error);
        }
        return new PersistenceException(operation, entityType, entityId, error);
    }

    private static boolean isTimeout(Throwable error) {
        return error instanceof TimeoutException
                || error instanceof QueryTimeoutException
                || error instanceof R2dbcTimeoutException
                || error instanceof MongoTimeoutException
                || error instanceof MongoExecutionTimeoutException;
    }

    private static String sqlState(Throwable error) {
        R2dbcException r2dbc = findCause(error, R2dbcException.class);
        return r2dbc != null ? r2dbc.getSqlState() : null;
    }

    private static <E extends Throwable> E findCause(Throwable error, Class<E> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}

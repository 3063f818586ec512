package org.javai.recovery.classify;

import org.javai.recovery.LatencyException;
import org.javai.recovery.TransientFaultException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * The classifier used when none is configured.
 *
 * <p>Failures are assumed transient unless they belong to a category known to be
 * permanent: unknown hosts, missing or inaccessible files, an exceeded latency bound,
 * interruption and programming defects. The cause chain is walked outermost first and the
 * first recognised category wins, so a runtime exception wrapping a
 * {@link SocketTimeoutException} is still a network timeout.
 *
 * <p>A nested engine's {@code AggregatedFailureException} is classified through its cause,
 * which is its newest entry: transient when the nested engine ran out of retries, and
 * whatever its last failure was otherwise.
 */
public class DefaultTransientFaultClassifier implements TransientFaultClassifier {

    public static final DefaultTransientFaultClassifier INSTANCE = new DefaultTransientFaultClassifier();

    private record CategoryMapping(Predicate<Throwable> matches, FaultCategory category) {

        static CategoryMapping of(Class<? extends Throwable> type, FaultCategory category) {
            return new CategoryMapping(type::isInstance, category);
        }
    }

    // Subtypes before their supertypes: UnknownHostException and FileNotFoundException are IOExceptions.
    private static final List<CategoryMapping> MAPPINGS = List.of(
            CategoryMapping.of(SocketTimeoutException.class, FaultCategory.NETWORK_TIMEOUT),
            CategoryMapping.of(HttpTimeoutException.class, FaultCategory.NETWORK_TIMEOUT),
            CategoryMapping.of(ConnectException.class, FaultCategory.CONNECTION_REFUSED),
            CategoryMapping.of(UnknownHostException.class, FaultCategory.UNKNOWN_HOST),
            CategoryMapping.of(SocketException.class, FaultCategory.SOCKET),
            CategoryMapping.of(FileNotFoundException.class, FaultCategory.FILE_NOT_FOUND),
            CategoryMapping.of(NoSuchFileException.class, FaultCategory.FILE_NOT_FOUND),
            CategoryMapping.of(AccessDeniedException.class, FaultCategory.ACCESS_DENIED),
            CategoryMapping.of(IOException.class, FaultCategory.IO),
            CategoryMapping.of(TimeoutException.class, FaultCategory.OPERATION_TIMEOUT),
            CategoryMapping.of(SQLTransientException.class, FaultCategory.SQL_TRANSIENT),
            CategoryMapping.of(SQLRecoverableException.class, FaultCategory.SQL_TRANSIENT),
            new CategoryMapping(DefaultTransientFaultClassifier::isConnectionSqlState, FaultCategory.SQL_TRANSIENT),
            CategoryMapping.of(TransientFaultException.class, FaultCategory.SERVICE_UNAVAILABLE),
            CategoryMapping.of(LatencyException.class, FaultCategory.LATENCY_EXCEEDED),
            CategoryMapping.of(InterruptedException.class, FaultCategory.INTERRUPTED),
            CategoryMapping.of(NullPointerException.class, FaultCategory.DEFECT),
            CategoryMapping.of(IllegalArgumentException.class, FaultCategory.DEFECT),
            CategoryMapping.of(IllegalStateException.class, FaultCategory.DEFECT),
            CategoryMapping.of(UnsupportedOperationException.class, FaultCategory.DEFECT),
            CategoryMapping.of(IndexOutOfBoundsException.class, FaultCategory.DEFECT),
            CategoryMapping.of(ClassCastException.class, FaultCategory.DEFECT),
            CategoryMapping.of(ArithmeticException.class, FaultCategory.DEFECT)
    );

    @Override
    public boolean isTransient(Throwable failure) {
        return categorize(failure).isTransient();
    }

    /**
     * Returns the category of the first failure in the cause chain that has one,
     * or {@link FaultCategory#UNCATEGORIZED}.
     */
    public FaultCategory categorize(Throwable failure) {
        for (Throwable t : CauseChain.of(failure)) {
            for (CategoryMapping mapping : MAPPINGS) {
                if (mapping.matches().test(t)) {
                    return mapping.category();
                }
            }
        }
        return FaultCategory.UNCATEGORIZED;
    }

    private static boolean isConnectionSqlState(Throwable t) {
        if (t instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            return sqlState != null && sqlState.startsWith("08");
        }
        return false;
    }
}

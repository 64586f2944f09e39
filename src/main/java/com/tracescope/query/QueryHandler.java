package com.tracescope.query;

import com.tracescope.domain.QueryRequest;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

/**
 * Envelope applied to every query service operation.
 * 
 * {@link #handle} times the operation until its Mono terminates, and turns
 * any failure, thrown or signalled, into a {@link QueryException} after
 * logging and counting it. {@link #handleQuery} additionally rejects
 * requests without a service name before anything is timed or counted.
 */
@Component
public class QueryHandler {
    
    private static final Logger log = LoggerFactory.getLogger(QueryHandler.class);
    
    static final String NO_SERVICE_NAME = "No service name provided";
    
    private final QueryMetrics metrics;
    
    public QueryHandler(QueryMetrics metrics) {
        this.metrics = metrics;
    }
    
    /**
     * @param name Operation name used for logging and metrics
     * @param operation Produces the operation's result; invoked on subscription
     * @return The operation's result, or a QueryException
     */
    public <T> Mono<T> handle(String name, Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
                Timer.Sample sample = metrics.startTimer();
                Mono<T> result;
                try {
                    result = operation.get();
                } catch (RuntimeException e) {
                    result = Mono.error(e);
                }
                return result.doFinally(signal -> metrics.recordLatency(sample, name));
            })
            .onErrorMap(error -> {
                log.error("{} error", name, error);
                metrics.recordError(name, error);
                return new QueryException(error.toString());
            });
    }
    
    /**
     * Like {@link #handle}, for operations driven by a search request.
     * 
     * @param name Operation name used for logging and metrics
     * @param request The search request; its service name must be non-empty
     * @param operation Produces the operation's result
     * @return The operation's result, an InvalidQueryException, or a QueryException
     */
    public <T> Mono<T> handleQuery(String name, QueryRequest request, Supplier<Mono<T>> operation) {
        if (request == null || request.getServiceName() == null || request.getServiceName().isEmpty()) {
            return Mono.error(new InvalidQueryException(NO_SERVICE_NAME));
        }
        log.debug("{} serviceName={} endTs={} limit={}",
            name, request.getServiceName(), request.getEndTs(), request.getLimit());
        return handle(name, operation);
    }
}

package com.flagship.split_escrow.job;

import com.flagship.split_escrow.exception.JobTypeNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job types known to this process, keyed by type name.
 * Every {@link JobHandler} bean registers itself at startup.
 */
@Component
@Slf4j
public class JobRegistry {

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    public JobRegistry(List<JobHandler> discovered) {
        discovered.forEach(this::register);
    }

    public void register(JobHandler handler) {
        JobDefinition definition = handler.definition();
        JobHandler previous = handlers.putIfAbsent(definition.getType(), handler);
        if (previous != null && previous != handler) {
            throw new IllegalStateException("Job type registered twice: " + definition.getType());
        }
        log.info("Registered job type: type={}, maxAttempts={}, timeout={}s, concurrency={}",
                definition.getType(),
                definition.getPolicy().getMaxAttempts(),
                definition.getPolicy().getTimeoutSeconds(),
                definition.getPolicy().getConcurrencyLimit());
    }

    public JobHandler handlerFor(String jobType) {
        JobHandler handler = handlers.get(jobType);
        if (handler == null) {
            throw new JobTypeNotFoundException(jobType);
        }
        return handler;
    }

    public JobDefinition definition(String jobType) {
        return handlerFor(jobType).definition();
    }

    public Collection<JobDefinition> definitions() {
        return handlers.values().stream().map(JobHandler::definition).toList();
    }

    public boolean isRegistered(String jobType) {
        return handlers.containsKey(jobType);
    }

    /**
     * Rejects unknown types first, then payloads that violate the type's schema.
     */
    public JobDefinition validate(String jobType, Map<String, Object> payload) {
        JobDefinition definition = definition(jobType);
        definition.getSchema().validate(jobType, payload);
        return definition;
    }
}

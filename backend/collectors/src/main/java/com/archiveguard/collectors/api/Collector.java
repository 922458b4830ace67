package com.archiveguard.collectors.api;

/**
 * One periodic collection job. A call to {@link #collect(CollectorContext)} is a single bounded,
 * synchronous tick; failures surface as exceptions and are bookkept by the caller.
 */
public interface Collector {
    JobType jobType();

    CollectorResult collect(CollectorContext ctx);
}

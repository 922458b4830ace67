package com.archiveguard.service.runtime;

public record CollectionStatistics(Today today, ErrorCounts errors) {
    public static final CollectionStatistics EMPTY =
            new CollectionStatistics(new Today(0, 0), new ErrorCounts(0, 0, 0));

    /**
     * Collected since local midnight.
     */
    public record Today(long sensorCollections, long rfidScans) {
    }

    public record ErrorCounts(int total, int sensor, int rfid) {
    }
}

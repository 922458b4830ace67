package com.archiveguard.collectors.rfid;

import com.archiveguard.collectors.api.Collector;
import com.archiveguard.collectors.api.CollectorContext;
import com.archiveguard.collectors.api.CollectorResult;
import com.archiveguard.collectors.api.JobType;
import com.archiveguard.collectors.device.TagDetection;
import com.archiveguard.core.events.RfidTagSighted;
import com.archiveguard.core.model.RfidTag;
import com.archiveguard.core.model.TagSighting;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

public class RfidCollector implements Collector {
    private static final Logger LOGGER = Logger.getLogger(RfidCollector.class.getName());

    @Override
    public JobType jobType() {
        return JobType.RFID;
    }

    @Override
    public CollectorResult collect(CollectorContext ctx) {
        Optional<TagDetection> detection = ctx.deviceSampler().scanRfid();
        if (detection.isEmpty()) {
            return CollectorResult.success("RFID scan completed, no tag detected", Map.of("sightings", 0));
        }

        TagDetection detected = detection.get();
        Optional<RfidTag> tag = ctx.readingStore().findTag(detected.tagId()).filter(RfidTag::isActive);
        if (tag.isEmpty()) {
            LOGGER.info("Ignoring detection of unknown or inactive tag " + detected.tagId());
            return CollectorResult.success("RFID scan completed, unknown tag ignored", Map.of("sightings", 0));
        }

        Instant seenAt = ctx.clock().instant();
        TagSighting sighting = new TagSighting(
                detected.tagId(),
                tag.get().archiveId(),
                detected.deviceId(),
                detected.location(),
                seenAt
        );
        ctx.readingStore().recordSighting(sighting);
        ctx.eventBus().publish(new RfidTagSighted(seenAt, detected.tagId(), detected.deviceId(), detected.location()));
        LOGGER.fine(() -> "RFID tag " + detected.tagId() + " seen at " + detected.location());
        return CollectorResult.success("RFID scan completed", Map.of("sightings", 1, "tagId", detected.tagId()));
    }
}

package com.hits.service.core.config;

import com.hits.service.core.aggregate.AggregateRange;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hits")
public class HitsProperties {
    private String zone = "UTC";
    private Keys keys = new Keys();
    private Aggregation aggregation = new Aggregation();
    private Storage storage = new Storage();
    private Badge badge = new Badge();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    /** Zone used for calendar boundaries (start of day, month and year). */
    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(zone.trim());
    }

    public Keys getKeys() {
        return keys;
    }

    public void setKeys(Keys keys) {
        this.keys = keys;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public void setAggregation(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Badge getBadge() {
        return badge;
    }

    public void setBadge(Badge badge) {
        this.badge = badge;
    }

    public static class Keys {
        private int maxLength = 256;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }
    }

    public static class Aggregation {
        private List<AggregateRange> ranges = new ArrayList<>(EnumSet.allOf(AggregateRange.class));

        public List<AggregateRange> getRanges() {
            return ranges;
        }

        public void setRanges(List<AggregateRange> ranges) {
            this.ranges = ranges;
        }
    }

    public static class Storage {
        private String schema = "public";
        private int partitions = 128;
        private boolean initialize = true;

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public boolean isInitialize() {
            return initialize;
        }

        public void setInitialize(boolean initialize) {
            this.initialize = initialize;
        }
    }

    public static class Badge {
        private String label = "hits";
        private String color = "blue";

        public String getLabel() {
            return label;
        }

        public void setLabel(String label) {
            this.label = label;
        }

        public String getColor() {
            return color;
        }

        public void setColor(String color) {
            this.color = color;
        }
    }
}

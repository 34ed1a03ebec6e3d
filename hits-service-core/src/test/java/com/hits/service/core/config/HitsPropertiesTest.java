package com.hits.service.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.hits.service.core.aggregate.AggregateRange;
import java.time.ZoneId;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class HitsPropertiesTest {

    @Test
    void defaultsMatchDeployment() {
        HitsProperties properties = new HitsProperties();

        assertThat(properties.zoneId()).isEqualTo(ZoneId.of("UTC"));
        assertThat(properties.getKeys().getMaxLength()).isEqualTo(256);
        assertThat(properties.getStorage().getPartitions()).isEqualTo(128);
        assertThat(properties.getStorage().getSchema()).isEqualTo("public");
        assertThat(properties.getStorage().isInitialize()).isTrue();
        assertThat(properties.getAggregation().getRanges()).containsExactly(AggregateRange.values());
        assertThat(properties.getBadge().getLabel()).isEqualTo("hits");
    }

    @Test
    void bindsRelaxedNames() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "hits.zone", "Europe/Berlin",
                "hits.keys.max-length", "64",
                "hits.aggregation.ranges", "total,this-month",
                "hits.storage.partitions", "16",
                "hits.storage.schema", "counting",
                "hits.badge.color", "green"));

        HitsProperties properties = new Binder(source)
                .bind("hits", Bindable.ofInstance(new HitsProperties()))
                .get();

        assertThat(properties.zoneId()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(properties.getKeys().getMaxLength()).isEqualTo(64);
        assertThat(properties.getAggregation().getRanges())
                .containsExactly(AggregateRange.TOTAL, AggregateRange.THIS_MONTH);
        assertThat(properties.getStorage().getPartitions()).isEqualTo(16);
        assertThat(properties.getStorage().getSchema()).isEqualTo("counting");
        assertThat(properties.getBadge().getColor()).isEqualTo("green");
    }

    @Test
    void blankZoneFallsBackToUtc() {
        HitsProperties properties = new HitsProperties();
        properties.setZone(" ");

        assertThat(properties.zoneId()).isEqualTo(ZoneId.of("UTC"));
    }
}

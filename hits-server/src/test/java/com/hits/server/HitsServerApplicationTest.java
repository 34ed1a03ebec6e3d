package com.hits.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.hits.service.core.config.HitsProperties;
import com.hits.service.core.counter.CounterStore;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {"hits.storage.initialize=false", "hits.badge.label=views"})
@AutoConfigureMockMvc
class HitsServerApplicationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private HitsProperties properties;

    @MockBean
    private CounterStore counterStore;

    @Test
    void wiresHitEndpointThroughEngineToStore() throws Exception {
        when(counterStore.increment(eq("demo"), any(Instant.class))).thenReturn(1L);
        when(counterStore.sumRange(eq("demo"), eq(Instant.EPOCH), any(Instant.class)))
                .thenReturn(7L);

        mvc.perform(get("/hits/demo")).andExpect(status().isOk()).andExpect(content().string("7"));

        verify(counterStore).increment(eq("demo"), any(Instant.class));
    }

    @Test
    void bindsApplicationConfiguration() throws Exception {
        assertThat(properties.getStorage().getPartitions()).isEqualTo(128);
        assertThat(properties.getBadge().getLabel()).isEqualTo("views");

        when(counterStore.increment(eq("demo"), any(Instant.class))).thenReturn(1L);
        when(counterStore.sumRange(eq("demo"), any(Instant.class), any(Instant.class)))
                .thenReturn(1L);

        mvc.perform(get("/badge/demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.label").value("views"))
                .andExpect(jsonPath("$.message").value("1"));
    }

    @Test
    void statsIssueOneRangeQueryPerConfiguredRange() throws Exception {
        when(counterStore.sumRange(eq("demo"), any(Instant.class), any(Instant.class)))
                .thenReturn(3L);

        mvc.perform(get("/api/stats/demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.thisYear").value(3));

        verify(counterStore, times(4)).sumRange(eq("demo"), any(Instant.class), any(Instant.class));
    }
}

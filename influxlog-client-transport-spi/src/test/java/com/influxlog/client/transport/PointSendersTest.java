package com.influxlog.client.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PointSendersTest {

    @Test
    void finds_registered_provider_by_name_ignoring_case() {
        PointSender sender = PointSenders.create("Noop", StoreOptions.builder().build());

        assertThat(sender).isInstanceOf(NoopPointSenderProvider.NoopSender.class);
    }

    @Test
    void unknown_transport_lists_available_ones() {
        assertThatThrownBy(() -> PointSenders.create("carrier-pigeon", StoreOptions.builder().build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("carrier-pigeon")
                .hasMessageContaining("noop");
    }
}

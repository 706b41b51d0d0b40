package com.influxlog.client.sink;

import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.PointSenderProvider;
import com.influxlog.client.transport.StoreOptions;

public class StdoutPointSenderProvider implements PointSenderProvider {
    @Override
    public String name() {
        return "stdout";
    }

    @Override
    public PointSender create(StoreOptions options) {
        return new StdoutPointSender();
    }
}

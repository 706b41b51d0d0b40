package com.influxlog.client.transport.apache;

import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.PointSenderProvider;
import com.influxlog.client.transport.StoreOptions;

public class ApachePointSenderProvider implements PointSenderProvider {
    @Override
    public String name() {
        return "apache";
    }

    @Override
    public PointSender create(StoreOptions options) {
        return new ApachePointSender(options);
    }
}

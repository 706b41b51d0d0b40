package com.influxlog.client.transport.okhttp;

import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.PointSenderProvider;
import com.influxlog.client.transport.StoreOptions;

public class OkHttpPointSenderProvider implements PointSenderProvider {
    @Override
    public String name() {
        return "okhttp";
    }

    @Override
    public PointSender create(StoreOptions options) {
        return new OkHttpPointSender(options);
    }
}

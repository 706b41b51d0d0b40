package com.influxlog.client.transport.jdkhttp;

import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.PointSenderProvider;
import com.influxlog.client.transport.StoreOptions;

public class JdkHttpPointSenderProvider implements PointSenderProvider {
    @Override
    public String name() {
        return "jdkhttp";
    }

    @Override
    public PointSender create(StoreOptions options) {
        return new JdkHttpPointSender(options);
    }
}

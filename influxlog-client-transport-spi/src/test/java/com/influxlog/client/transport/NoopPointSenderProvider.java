package com.influxlog.client.transport;

import com.influxlog.point.Point;
import java.util.List;

public class NoopPointSenderProvider implements PointSenderProvider {
    @Override
    public String name() {
        return "noop";
    }

    @Override
    public PointSender create(StoreOptions options) {
        return new NoopSender();
    }

    static class NoopSender implements PointSender {
        @Override
        public void write(String database, List<Point> points) {}
    }
}

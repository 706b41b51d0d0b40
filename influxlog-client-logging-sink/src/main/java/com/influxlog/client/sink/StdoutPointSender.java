package com.influxlog.client.sink;

import com.influxlog.client.transport.PointSender;
import com.influxlog.point.LineProtocol;
import com.influxlog.point.Point;
import java.io.PrintStream;
import java.util.List;

/** Dev-only sink that prints line protocol to stdout. */
public class StdoutPointSender implements PointSender {
    private final PrintStream out;

    public StdoutPointSender() {
        this(System.out);
    }

    public StdoutPointSender(PrintStream out) {
        this.out = out;
    }

    @Override
    public void write(String database, List<Point> points) {
        if (points == null || points.isEmpty()) return;
        out.print("[influxlog db=" + database + "]\n" + LineProtocol.encode(points));
        out.flush();
    }
}

package com.influxlog.collection.core.point;

import com.influxlog.collection.core.classify.Classification;
import com.influxlog.collection.core.classify.ClassificationConfig;
import com.influxlog.collection.core.classify.RecordClassifier;
import com.influxlog.point.Point;
import com.influxlog.record.LogRecord;
import com.influxlog.record.LoggerNames;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns one record into the points written for it.
 *
 * <p>With backpop on and no measurement override, the record is written once per level of its
 * logger hierarchy, nearest first, so a query on {@code a:b} also sees records of {@code a:b:c}.
 */
@Slf4j
public final class PointFactory {
    private final RecordClassifier classifier;
    private final PointBuilder builder;
    private final boolean backpop;

    public PointFactory(ClassificationConfig config, boolean backpop) {
        this(new RecordClassifier(config), new PointBuilder(), backpop);
    }

    public PointFactory(RecordClassifier classifier, PointBuilder builder, boolean backpop) {
        this.classifier = classifier;
        this.builder = builder;
        this.backpop = backpop;
    }

    public ClassificationConfig config() {
        return classifier.config();
    }

    public boolean backpop() {
        return backpop;
    }

    /**
     * @throws com.influxlog.point.MalformedPointException when the classified record cannot form a point
     */
    public List<Point> toPoints(LogRecord record) {
        Classification c = classifier.classify(record);
        if (!c.rejected().isEmpty()) {
            log.debug("Skipped attributes of {} record: {}", c.measurement(), c.rejected());
        }
        Point base = builder.build(c);
        if (!backpop || classifier.config().measurement() != null) return List.of(base);

        List<String> scopes = LoggerNames.ancestors(c.measurement());
        List<Point> points = new ArrayList<>(scopes.size());
        points.add(base);
        for (int i = 1; i < scopes.size(); i++) {
            points.add(builder.relocate(base, scopes.get(i)));
        }
        return points;
    }
}

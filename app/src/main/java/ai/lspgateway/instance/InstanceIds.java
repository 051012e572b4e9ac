package ai.lspgateway.instance;

import java.util.concurrent.atomic.AtomicLong;

/** Generates {@code {primaryName}-{millis}} instance ids that sort by creation and never repeat within a JVM. */
public final class InstanceIds {
    private static final AtomicLong lastMillis = new AtomicLong();

    private InstanceIds() {}

    public static String next(String primaryName) {
        long now = System.currentTimeMillis();
        long millis = lastMillis.updateAndGet(last -> Math.max(now, last + 1));
        return primaryName + "-" + millis;
    }
}

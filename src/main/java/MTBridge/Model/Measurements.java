package MTBridge.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Named duration measurements. A split is stopped when closed, so try-with-resources
 * records the duration on every exit path.
 */
public interface Measurements {

    Split start(String label);

    /**
     * @return last recorded duration of label in microseconds, if any
     */
    OptionalLong get(String label);

    Map<String, Long> durations();

    interface Split extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * recording(): keeps the last duration of every label.
     */
    static Measurements recording() {
        return new Measurements() {
            final Map<String, Long> durations = new LinkedHashMap<>();

            @Override
            public Split start(String label) {
                durations.remove(label); // clear previous duration
                final long before = System.nanoTime();
                return new Split() {
                    boolean stopped = false;

                    @Override
                    public void close() {
                        if (!stopped) {
                            stopped = true;
                            durations.put(label, (System.nanoTime() - before) / 1000L);
                        }
                    }
                };
            }

            @Override
            public OptionalLong get(String label) {
                final Long duration = durations.get(label);
                return duration == null ? OptionalLong.empty() : OptionalLong.of(duration);
            }

            @Override
            public Map<String, Long> durations() {
                return Collections.unmodifiableMap(durations);
            }
        };
    }

    static Measurements noop() {
        return new Measurements() {
            @Override
            public Split start(String label) {
                return () -> { };
            }

            @Override
            public OptionalLong get(String label) {
                return OptionalLong.empty();
            }

            @Override
            public Map<String, Long> durations() {
                return Collections.emptyMap();
            }
        };
    }
}

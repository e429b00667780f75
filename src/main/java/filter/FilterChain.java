package filter;

import org.opencv.core.Mat;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Runs a set of {@link ImageFilter}s on one image, each after the filters it requires.
 */
public class FilterChain {

    private static final Logger logger = Logger.getLogger(FilterChain.class.getName());

    private final Map<String, ImageFilter> filters = new LinkedHashMap<>();

    /**
     * Registers a filter.
     *
     * @throws IllegalArgumentException if a filter with the same name is already registered
     */
    public FilterChain add(ImageFilter filter) {
        if (filters.containsKey(filter.getName())) {
            throw new IllegalArgumentException("Filter already registered: " + filter.getName());
        }
        filters.put(filter.getName(), filter);
        return this;
    }

    /**
     * Runs every registered filter once, dependencies first.
     *
     * @param image the source image (caller owns this Mat)
     * @return results keyed by filter name, in execution order
     * @throws IllegalStateException if a dependency is not registered or dependencies form a cycle
     */
    public Map<String, Object> run(Mat image) {
        Map<String, Object> results = new LinkedHashMap<>();
        for (String name : filters.keySet()) {
            runWithDependencies(name, image, results, new ArrayDeque<>());
        }
        return results;
    }

    private void runWithDependencies(String name, Mat image, Map<String, Object> results, Deque<String> path) {
        if (results.containsKey(name)) {
            return;
        }
        if (path.contains(name)) {
            throw new IllegalStateException("Cyclic filter dependency: " + String.join(" -> ", path) + " -> " + name);
        }

        ImageFilter filter = filters.get(name);
        if (filter == null) {
            throw new IllegalStateException("Filter '" + path.peekLast() + "' requires '" + name
                    + "' which is not registered");
        }

        path.addLast(name);
        for (String dependency : filter.required()) {
            runWithDependencies(dependency, image, results, path);
        }
        path.removeLast();

        Set<String> required = new HashSet<>(filter.required());
        Map<String, Object> upstream = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : results.entrySet()) {
            if (required.contains(entry.getKey())) {
                upstream.put(entry.getKey(), entry.getValue());
            }
        }

        long start = System.nanoTime();
        Object result = filter.run(image, Collections.unmodifiableMap(upstream));
        logger.fine(String.format("Filter %s finished in %.1f ms", name, (System.nanoTime() - start) / 1e6));

        results.put(name, result);
    }
}

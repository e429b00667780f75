package filter;

import org.opencv.core.Mat;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * A named step of a {@link FilterChain}. A filter may depend on the results of other filters,
 * which the chain runs first and passes in by name.
 */
public interface ImageFilter {

    /**
     * @return unique name under which the chain publishes this filter's result
     */
    String getName();

    /**
     * @return names of the filters whose results {@link #run} needs
     */
    default Set<String> required() {
        return Collections.emptySet();
    }

    /**
     * Runs the filter.
     *
     * @param image the source image (caller owns this Mat)
     * @param upstream results of the filters named by {@link #required()}, keyed by name
     * @return the filter's result
     * @throws IllegalStateException if a required upstream result is missing or has the wrong type
     */
    Object run(Mat image, Map<String, Object> upstream);
}

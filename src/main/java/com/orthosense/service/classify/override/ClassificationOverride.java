package com.orthosense.service.classify.override;

import com.orthosense.domain.ClassificationResult;
import com.orthosense.domain.Window;

/**
 * Geometry-only correction applied to the fused classification of a window.
 *
 * <p>Overrides run in a fixed order before the confidence gate and never change the numeric
 * confidence. Implementations must be stateless.
 */
public interface ClassificationOverride {

    /**
     * @param window  window being classified
     * @param current decision so far (never null)
     * @return the corrected decision, or {@code current} when the rule does not fire
     */
    ClassificationResult apply(Window window, ClassificationResult current);

    /** Short name used in logs and metrics. */
    String name();
}

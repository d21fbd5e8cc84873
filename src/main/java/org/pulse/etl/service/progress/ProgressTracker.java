package org.pulse.etl.service.progress;

/**
 * Converts (step, fraction) into an overall percentage for one run.
 * Reported values never decrease and reach exactly 100 when the final step completes.
 */
public class ProgressTracker {

    private final int totalSteps;
    private final double stepSize;
    private double current;

    public ProgressTracker(int totalSteps) {
        if (totalSteps < 1) {
            throw new IllegalArgumentException("totalSteps must be at least 1, got " + totalSteps);
        }
        this.totalSteps = totalSteps;
        this.stepSize = 100.0 / totalSteps;
    }

    /**
     * @param step     zero-based step index
     * @param fraction completed share of the step in [0, 1]; {@code null} marks the step as done
     * @return the overall percentage after this update
     */
    public synchronized double update(int step, Double fraction) {
        if (step < 0 || step >= totalSteps) {
            throw new IllegalArgumentException("step " + step + " outside [0, " + totalSteps + ")");
        }
        double candidate;
        if (fraction == null || (step == totalSteps - 1 && fraction >= 1.0)) {
            candidate = step == totalSteps - 1 ? 100.0 : (step + 1) * stepSize;
        } else {
            double clamped = Math.max(0.0, Math.min(1.0, fraction));
            candidate = step * stepSize + clamped * stepSize;
        }
        current = Math.min(100.0, Math.max(current, candidate));
        return current;
    }

    public synchronized double complete() {
        current = 100.0;
        return current;
    }

    public synchronized double current() {
        return current;
    }

    public int totalSteps() {
        return totalSteps;
    }
}

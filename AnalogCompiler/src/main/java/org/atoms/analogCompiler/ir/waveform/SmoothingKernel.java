package org.atoms.analogCompiler.ir.waveform;

/** Kernels available for {@link Smooth}.
 * Kernels with infinite support are truncated at CUTOFF. */
public enum SmoothingKernel {
    GAUSSIAN(false),
    LOGISTIC(false),
    SIGMOID(false),
    TRIANGLE(true),
    UNIFORM(true),
    PARABOLIC(true),
    BIWEIGHT(true),
    TRIWEIGHT(true),
    TRICUBE(true),
    COSINE(true);

    static final double CUTOFF = 5.0;

    private final boolean boundedSupport;

    SmoothingKernel(boolean boundedSupport) {
        this.boundedSupport = boundedSupport;
    }

    /** Half-width of the window, in units of the radius. */
    public double support() {
        return this.boundedSupport ? 1.0 : CUTOFF;
    }

    public double weight(double x) {
        double abs = Math.abs(x);
        if (this.boundedSupport && abs > 1)
            return 0;
        switch (this) {
            case GAUSSIAN:
                return Math.exp(-x * x / 2) / Math.sqrt(2 * Math.PI);
            case LOGISTIC:
                return 1 / (Math.exp(x) + 2 + Math.exp(-x));
            case SIGMOID:
                return (2 / Math.PI) / (Math.exp(x) + Math.exp(-x));
            case TRIANGLE:
                return 1 - abs;
            case UNIFORM:
                return 0.5;
            case PARABOLIC:
                return 0.75 * (1 - x * x);
            case BIWEIGHT:
                return 15.0 / 16 * Math.pow(1 - x * x, 2);
            case TRIWEIGHT:
                return 35.0 / 32 * Math.pow(1 - x * x, 3);
            case TRICUBE:
                return 70.0 / 81 * Math.pow(1 - abs * abs * abs, 3);
            case COSINE:
                return Math.PI / 4 * Math.cos(Math.PI * x / 2);
            default:
                throw new IllegalStateException("Unexpected kernel " + this);
        }
    }
}

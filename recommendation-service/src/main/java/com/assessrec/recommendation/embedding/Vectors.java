package com.assessrec.recommendation.embedding;

public final class Vectors {

    private Vectors() {
    }

    /**
     * Returns a unit-length copy of {@code vector}. A zero vector is returned unchanged.
     */
    public static float[] normalize(float[] vector) {
        double sumSquares = 0.0;
        for (float v : vector) {
            sumSquares += (double) v * v;
        }
        float[] out = new float[vector.length];
        if (sumSquares == 0.0) {
            return out;
        }
        double norm = Math.sqrt(sumSquares);
        for (int i = 0; i < vector.length; i++) {
            out[i] = (float) (vector[i] / norm);
        }
        return out;
    }
}

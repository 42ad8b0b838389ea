package com.examgrader.utils;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniformly distributed integers in {@code [0, bound)}.
 */
@FunctionalInterface
public interface UniformSampler {

    int nextInt(int bound);

    static UniformSampler threadLocal() {
        return bound -> ThreadLocalRandom.current().nextInt(bound);
    }
}

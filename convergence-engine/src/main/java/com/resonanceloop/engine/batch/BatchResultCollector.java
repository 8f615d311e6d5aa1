package com.resonanceloop.engine.batch;

import com.resonanceloop.common.model.ConvergenceResult;

import java.util.Arrays;
import java.util.List;

/**
 * Slot-per-task result store. Appends are mutually exclusive; slot {@code i} holds the
 * result of the {@code i}-th submitted pair, so reading back preserves submission order.
 */
final class BatchResultCollector {

    private final ConvergenceResult[] slots;

    BatchResultCollector(int size) {
        this.slots = new ConvergenceResult[size];
    }

    synchronized void record(int index, ConvergenceResult result) {
        if (slots[index] != null) {
            throw new IllegalStateException("result for batch slot " + index + " already recorded");
        }
        slots[index] = result;
    }

    synchronized List<ConvergenceResult> results() {
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                throw new IllegalStateException("batch slot " + i + " has no result");
            }
        }
        return List.of(Arrays.copyOf(slots, slots.length));
    }
}

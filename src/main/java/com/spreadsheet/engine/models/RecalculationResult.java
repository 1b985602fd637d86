package com.spreadsheet.engine.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one committed set-cell recomputed: the layers in evaluation order,
 * each layer in ascending (row, column) order. The target is always in the first layer.
 */
public final class RecalculationResult {
    private final Address target;
    private final List<List<Address>> layers;

    public RecalculationResult(Address target, List<List<Address>> layers) {
        this.target = target;
        List<List<Address>> copy = new ArrayList<>(layers.size());
        for (List<Address> layer : layers) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(layer)));
        }
        this.layers = Collections.unmodifiableList(copy);
    }

    public Address getTarget() {
        return target;
    }

    public List<List<Address>> getLayers() {
        return layers;
    }

    public List<Address> getEvaluationOrder() {
        List<Address> order = new ArrayList<>();
        for (List<Address> layer : layers) {
            order.addAll(layer);
        }
        return order;
    }
}

package io.surfworks.tsetlin.core.model;

import io.surfworks.tsetlin.core.classifier.ClassifierException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Bijection between user labels and the dense class indices the engine works with.
 *
 * <p>Labels are kept sorted ascending and distinct; index {@code i} is the
 * {@code i}-th smallest label. A mapping always has at least two classes.
 *
 * @param <L> label type
 */
public final class LabelMapping<L extends Comparable<? super L>> implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<L> classes;
    private transient Map<L, Integer> indexByLabel;

    private LabelMapping(List<L> classes) {
        this.classes = Collections.unmodifiableList(classes);
    }

    /**
     * Builds a mapping from the distinct values of {@code labels}.
     *
     * @throws ClassifierException if fewer than two distinct labels are present
     */
    public static <L extends Comparable<? super L>> LabelMapping<L> fit(Collection<? extends L> labels) {
        TreeSet<L> distinct = new TreeSet<>();
        for (L label : labels) {
            if (label == null) {
                throw ClassifierException.validation("Labels must not be null");
            }
            distinct.add(label);
        }
        if (distinct.size() < 2) {
            throw ClassifierException.tooFewClasses(distinct.size());
        }
        return new LabelMapping<>(new ArrayList<>(distinct));
    }

    /**
     * Builds the mapping {@code 0 -> 0, ..., n-1 -> n-1}.
     */
    public static LabelMapping<Integer> ofIndices(int numClasses) {
        List<Integer> indices = new ArrayList<>(numClasses);
        for (int i = 0; i < numClasses; i++) {
            indices.add(i);
        }
        return fit(indices);
    }

    public List<L> classes() {
        return classes;
    }

    public int size() {
        return classes.size();
    }

    /**
     * Encodes labels as class indices.
     *
     * @throws ClassifierException if a label was not seen when the mapping was built
     */
    public int[] encode(List<? extends L> labels) {
        Map<L, Integer> index = index();
        int[] encoded = new int[labels.size()];
        for (int i = 0; i < encoded.length; i++) {
            L label = labels.get(i);
            Integer idx = label == null ? null : index.get(label);
            if (idx == null) {
                throw ClassifierException.validation("y contains previously unseen label: " + label);
            }
            encoded[i] = idx;
        }
        return encoded;
    }

    /**
     * Decodes class indices back to labels.
     *
     * @throws IndexOutOfBoundsException if an index is outside [0, size)
     */
    public List<L> decode(int[] indices) {
        List<L> labels = new ArrayList<>(indices.length);
        for (int idx : indices) {
            if (idx < 0 || idx >= classes.size()) {
                throw new IndexOutOfBoundsException(
                        "Class index " + idx + " out of range for " + classes.size() + " classes");
            }
            labels.add(classes.get(idx));
        }
        return labels;
    }

    /**
     * Returns true when {@code supplied} lists exactly this mapping's classes in the same order.
     */
    public boolean matches(List<? extends L> supplied) {
        return classes.equals(supplied);
    }

    private Map<L, Integer> index() {
        if (indexByLabel == null) {
            Map<L, Integer> map = new HashMap<>();
            for (int i = 0; i < classes.size(); i++) {
                map.put(classes.get(i), i);
            }
            indexByLabel = map;
        }
        return indexByLabel;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LabelMapping<?> other && classes.equals(other.classes);
    }

    @Override
    public int hashCode() {
        return classes.hashCode();
    }

    @Override
    public String toString() {
        return "LabelMapping" + classes;
    }
}

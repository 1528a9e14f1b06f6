package com.structbp.server.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A self-contained collection of elements. Elements register themselves on construction.
 */
public class Universe {

    private final String name;
    private final List<Element<?>> elements = new ArrayList<>();

    public Universe() {
        this("universe");
    }

    public Universe(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    void register(Element<?> element) {
        elements.add(element);
    }

    String nextElementName() {
        return name + "/e" + elements.size();
    }

    public List<Element<?>> getElements() {
        return Collections.unmodifiableList(elements);
    }

    /**
     * Elements carrying a hard condition, in registration order.
     */
    public List<Element<?>> conditionedElements() {
        List<Element<?>> result = new ArrayList<>();
        for (Element<?> e : elements) {
            if (e.isConditioned()) {
                result.add(e);
            }
        }
        return result;
    }

    /**
     * Elements carrying a soft constraint, in registration order.
     */
    public List<Element<?>> constrainedElements() {
        List<Element<?>> result = new ArrayList<>();
        for (Element<?> e : elements) {
            if (e.isConstrained()) {
                result.add(e);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Universe{" + name + ", elements=" + elements.size() + '}';
    }
}

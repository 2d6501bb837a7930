/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Axis bookkeeping shared by Series and DataFrame.
 */
public abstract class NDFrame {

    private final Map<Integer, Index> axes = new HashMap<>(2);
    private List<Integer> axisOrders = Collections.emptyList();

    protected void setupAxes(Integer... axes) {
        List<Integer> orders = new ArrayList<>(axes.length);
        Collections.addAll(orders, axes);
        this.axisOrders = Collections.unmodifiableList(orders);
    }

    /**
     * Assign labels to an axis.
     *
     * @param axis   axis number
     * @param labels labels of the axis
     */
    protected void setAxis(int axis, Index labels) {
        axes.put(axis, labels);
    }

    protected Index getAxis(int axis) {
        return axes.get(axis);
    }

    /**
     * Size of each axis, in axis order.
     */
    public List<Integer> shape() {
        List<Integer> shape = new ArrayList<>(axisOrders.size());
        for (Integer axis : axisOrders) {
            shape.add(getAxis(axis).size());
        }
        return Collections.unmodifiableList(shape);
    }

    public int ndim() {
        return axisOrders.size();
    }
}

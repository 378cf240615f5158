package org.mides.routing.util;

import java.util.ArrayList;
import java.util.List;

public class ArrayUtils {

    public static List<List<Double>> convertToNestedList(double[][] matrix) {
        if (matrix == null || matrix.length == 0) {
            throw new IllegalArgumentException("Input matrix cannot be null or empty");
        }

        int cols = matrix[0].length;
        List<List<Double>> result = new ArrayList<>(matrix.length);

        for (double[] row : matrix) {
            if (row.length != cols) {
                throw new IllegalArgumentException("All rows must have the same number of elements");
            }
            List<Double> values = new ArrayList<>(cols);
            for (double value : row) {
                values.add(Utils.round3(value));
            }
            result.add(values);
        }

        return result;
    }
}

/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.featurematrix.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import eu.openanalytics.featurematrix.enumeration.QualityCode;
import eu.openanalytics.featurematrix.exception.InvalidSnapshotException;

/**
 * A feature matrix: three parallel matrices (value, quality, calculation time) indexed by
 * [time series × operation], together with the time series, operation and master operation
 * metadata they describe.
 * <p>
 * Metadata is fixed for the lifetime of a store. Cells are written through {@link #setCell},
 * which keeps the value NaN for every non-good cell. Row and column deletions never happen in
 * place: {@link #subset} returns a new store in which all matrices and metadata are trimmed together.
 */
public class ValueStore {

    private final List<TimeSeries> timeSeries;
    private final List<Operation> operations;
    private final List<MasterOperation> masterOperations;
    private final Map<Long, MasterOperation> mastersById;

    private final double[][] values;
    private final int[][] quality;
    private final double[][] calcTimes;

    public ValueStore(List<TimeSeries> timeSeries, List<Operation> operations, List<MasterOperation> masterOperations,
                      double[][] values, int[][] quality, double[][] calcTimes) {
        if (timeSeries == null || operations == null || masterOperations == null) {
            throw new InvalidSnapshotException("Time series, operations and master operations must all be provided");
        }
        this.timeSeries = List.copyOf(timeSeries);
        this.operations = List.copyOf(operations);
        this.masterOperations = List.copyOf(masterOperations);

        this.mastersById = new LinkedHashMap<>();
        for (MasterOperation master : masterOperations) {
            if (mastersById.put(master.getId(), master) != null) {
                throw new InvalidSnapshotException("Duplicate master operation id %d", master.getId());
            }
        }
        for (Operation operation : operations) {
            if (!mastersById.containsKey(operation.getMasterId())) {
                throw new InvalidSnapshotException("Operation %s (%d) references unknown master operation %d",
                        operation.getName(), operation.getId(), operation.getMasterId());
            }
        }

        checkShape("value", values == null ? null : Arrays.stream(values).mapToInt(r -> r == null ? -1 : r.length).toArray());
        checkShape("quality", quality == null ? null : Arrays.stream(quality).mapToInt(r -> r == null ? -1 : r.length).toArray());
        checkShape("calculation time", calcTimes == null ? null : Arrays.stream(calcTimes).mapToInt(r -> r == null ? -1 : r.length).toArray());

        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                QualityCode code;
                try {
                    code = QualityCode.fromCode(quality[r][c]);
                } catch (IllegalArgumentException e) {
                    throw new InvalidSnapshotException("Invalid quality code %d at cell [%d, %d]", quality[r][c], r, c);
                }
                if (!code.isGood() && !Double.isNaN(values[r][c])) {
                    throw new InvalidSnapshotException("Cell [%d, %d] has quality %s but carries value %s", r, c, code, values[r][c]);
                }
            }
        }

        this.values = values;
        this.quality = quality;
        this.calcTimes = calcTimes;
    }

    /**
     * Creates a store in which no cell has been computed yet.
     */
    public static ValueStore create(List<TimeSeries> timeSeries, List<Operation> operations, List<MasterOperation> masterOperations) {
        int rows = timeSeries.size();
        int cols = operations.size();
        double[][] values = new double[rows][cols];
        int[][] quality = new int[rows][cols];
        double[][] calcTimes = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            Arrays.fill(values[r], Double.NaN);
            Arrays.fill(quality[r], QualityCode.NOT_COMPUTED.getCode());
            Arrays.fill(calcTimes[r], Double.NaN);
        }
        return new ValueStore(timeSeries, operations, masterOperations, values, quality, calcTimes);
    }

    private void checkShape(String matrixName, int[] rowLengths) {
        if (rowLengths == null) {
            throw new InvalidSnapshotException("The %s matrix is missing", matrixName);
        }
        if (rowLengths.length != timeSeries.size()) {
            throw new InvalidSnapshotException("The %s matrix has %d rows, expected %d (one per time series)",
                    matrixName, rowLengths.length, timeSeries.size());
        }
        for (int r = 0; r < rowLengths.length; r++) {
            if (rowLengths[r] != operations.size()) {
                throw new InvalidSnapshotException("Row %d of the %s matrix has %d columns, expected %d (one per operation)",
                        r, matrixName, rowLengths[r], operations.size());
            }
        }
    }

    public int getRowCount() {
        return timeSeries.size();
    }

    public int getColumnCount() {
        return operations.size();
    }

    public List<TimeSeries> getTimeSeries() {
        return timeSeries;
    }

    public List<Operation> getOperations() {
        return operations;
    }

    public List<MasterOperation> getMasterOperations() {
        return masterOperations;
    }

    public MasterOperation getMasterOperation(long masterId) {
        MasterOperation master = mastersById.get(masterId);
        if (master == null) {
            throw new IllegalArgumentException(String.format("No master operation with id %d", masterId));
        }
        return master;
    }

    public double getValue(int row, int col) {
        return values[row][col];
    }

    public QualityCode getQuality(int row, int col) {
        return QualityCode.fromCode(quality[row][col]);
    }

    public double getCalcTime(int row, int col) {
        return calcTimes[row][col];
    }

    /**
     * Writes one cell. Rows are independent, so concurrent writers must own disjoint rows.
     */
    public void setCell(int row, int col, double value, QualityCode qualityCode, double calcTime) {
        values[row][col] = qualityCode.isGood() ? value : Double.NaN;
        quality[row][col] = qualityCode.getCode();
        calcTimes[row][col] = calcTime;
    }

    public double[][] getValues() {
        return deepCopy(values);
    }

    public int[][] getQualityCodes() {
        return Arrays.stream(quality).map(int[]::clone).toArray(int[][]::new);
    }

    public double[][] getCalcTimes() {
        return deepCopy(calcTimes);
    }

    public long countCells(QualityCode qualityCode) {
        return Arrays.stream(quality).flatMapToInt(Arrays::stream).filter(q -> q == qualityCode.getCode()).count();
    }

    public Map<Long, List<Integer>> getColumnsByMaster() {
        return IntStream.range(0, operations.size()).boxed()
                .collect(Collectors.groupingBy(c -> operations.get(c).getMasterId(), LinkedHashMap::new, Collectors.toList()));
    }

    /**
     * Returns a new store restricted to the given row and column indices, in the given order.
     * All three matrices and both metadata lists are subset together; master operations are kept.
     */
    public ValueStore subset(int[] rows, int[] cols) {
        double[][] newValues = new double[rows.length][cols.length];
        int[][] newQuality = new int[rows.length][cols.length];
        double[][] newCalcTimes = new double[rows.length][cols.length];
        for (int i = 0; i < rows.length; i++) {
            for (int j = 0; j < cols.length; j++) {
                newValues[i][j] = values[rows[i]][cols[j]];
                newQuality[i][j] = quality[rows[i]][cols[j]];
                newCalcTimes[i][j] = calcTimes[rows[i]][cols[j]];
            }
        }
        return new ValueStore(
                select(timeSeries, rows),
                select(operations, cols),
                masterOperations,
                newValues, newQuality, newCalcTimes);
    }

    public ValueStore selectRows(int[] rows) {
        return subset(rows, IntStream.range(0, getColumnCount()).toArray());
    }

    public ValueStore selectColumns(int[] cols) {
        return subset(IntStream.range(0, getRowCount()).toArray(), cols);
    }

    /**
     * Returns a new store with the same metadata and calculation times, but with the given values and quality codes.
     */
    public ValueStore withValues(double[][] newValues, int[][] newQuality) {
        return new ValueStore(timeSeries, operations, masterOperations, newValues, newQuality, deepCopy(calcTimes));
    }

    public ValueStore withMasterOperations(List<MasterOperation> newMasterOperations) {
        return new ValueStore(timeSeries, operations, newMasterOperations, getValues(), getQualityCodes(), getCalcTimes());
    }

    public ValueStore copy() {
        return new ValueStore(timeSeries, operations, masterOperations, getValues(), getQualityCodes(), getCalcTimes());
    }

    public Map<Long, Integer> getRowIndexById() {
        return IntStream.range(0, timeSeries.size()).boxed()
                .collect(Collectors.toMap(r -> timeSeries.get(r).getId(), Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    private static <T> List<T> select(List<T> items, int[] indices) {
        return Arrays.stream(indices).mapToObj(items::get).toList();
    }

    private static double[][] deepCopy(double[][] matrix) {
        return Arrays.stream(matrix).map(double[]::clone).toArray(double[][]::new);
    }
}

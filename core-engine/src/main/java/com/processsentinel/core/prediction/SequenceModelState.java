package com.processsentinel.core.prediction;

import java.io.Serializable;

/**
 * JSON form of a trained {@link SequencePredictor}: network shape, the file
 * name of the serialized Weka network (resolved next to the JSON file) and the
 * min-max scaling of the training series.
 */
public class SequenceModelState implements Serializable {

    private static final long serialVersionUID = 1L;

    private int lookback;
    private int hiddenUnits;
    private String modelFile;
    private double min;
    private double max;

    public SequenceModelState() {
    }

    SequenceModelState(int lookback, int hiddenUnits, String modelFile, double min, double max) {
        this.lookback = lookback;
        this.hiddenUnits = hiddenUnits;
        this.modelFile = modelFile;
        this.min = min;
        this.max = max;
    }

    public int getLookback() {
        return lookback;
    }

    public void setLookback(int lookback) {
        this.lookback = lookback;
    }

    public int getHiddenUnits() {
        return hiddenUnits;
    }

    public void setHiddenUnits(int hiddenUnits) {
        this.hiddenUnits = hiddenUnits;
    }

    public String getModelFile() {
        return modelFile;
    }

    public void setModelFile(String modelFile) {
        this.modelFile = modelFile;
    }

    public double getMin() {
        return min;
    }

    public void setMin(double min) {
        this.min = min;
    }

    public double getMax() {
        return max;
    }

    public void setMax(double max) {
        this.max = max;
    }
}

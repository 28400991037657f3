/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package kishida.ffn.layers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.DoubleSummaryStatistics;
import java.util.Random;
import kishida.ffn.activation.ActivationFunction;
import kishida.ffn.activation.LogisticFunction;
import kishida.ffn.util.FloatUtil;
import lombok.Getter;

/**
 *
 * @author naoki
 */
public class NeuralLayer {
    @Getter
    @JsonProperty
    private final String name;

    @Getter
    @JsonProperty
    private final int inputSize;

    @Getter
    @JsonProperty
    private final int outputSize;

    @JsonIgnore
    @Getter
    private final float[] values;

    @JsonIgnore
    @Getter
    private final float[] bias;

    /** [outputSize][inputSize], null until initWeights */
    @JsonIgnore
    @Getter
    private float[][] weight;

    @JsonIgnore
    @Getter
    private final ActivationFunction activation;

    @JsonCreator
    public NeuralLayer(
            @JsonProperty("name") String name,
            @JsonProperty("inputSize") int inputSize,
            @JsonProperty("outputSize") int outputSize) {
        if(inputSize <= 0 || outputSize <= 0){
            throw new IllegalArgumentException(String.format(
                    "layer size must be positive: %d->%d", inputSize, outputSize));
        }
        this.name = name;
        this.inputSize = inputSize;
        this.outputSize = outputSize;
        this.values = new float[inputSize];
        this.bias = new float[inputSize];
        this.activation = LogisticFunction.INSTANCE;
    }

    public NeuralLayer(int inputSize, int outputSize) {
        this("layer", inputSize, outputSize);
    }

    /** 重みを[-1, 1]の一様乱数で初期化。出力層は重みを持たない */
    public void initWeights(NeuralLayer next, Random random){
        if(next == null){
            weight = null;
            return;
        }
        FloatUtil.checkSize(outputSize, next.inputSize, "input of " + next.name);
        weight = new float[outputSize][];
        for(int i = 0; i < outputSize; ++i){
            weight[i] = FloatUtil.createUniformArray(inputSize, -1, 1, random);
        }
    }

    public void forward(NeuralLayer next){
        if(next == null){
            return;
        }
        FloatUtil.checkSize(outputSize, next.inputSize, "input of " + next.name);
        checkWeights();
        for(int i = 0; i < outputSize; ++i){
            float d = FloatUtil.dot(weight[i], values) + next.bias[i];
            next.values[i] = activation.apply(d);
        }
    }

    /** 前の層の重みを更新して前の層のデルタを返す。デルタは更新後の重みから求める */
    public float[] backward(NeuralLayer prev, float[] delta, float learningRate){
        if(prev == null){
            return null;
        }
        FloatUtil.checkSize(prev.outputSize, inputSize, "input of " + name + " after " + prev.name);
        FloatUtil.checkSize(inputSize, delta.length, "delta of " + name);
        prev.checkWeights();
        float[] prevValues = prev.values;
        float[] prevDelta = new float[prev.inputSize];
        for(int i = 0; i < inputSize; ++i){
            float[] w = prev.weight[i];
            for(int j = 0; j < w.length; ++j){
                w[j] += learningRate * delta[i] * prevValues[j];
                // 前の行の結果は上書きされる
                prevDelta[j] = prev.activation.diff(prevValues[j]) * w[j] * delta[i];
            }
        }
        return prevDelta;
    }

    private void checkWeights(){
        if(weight == null){
            throw new IllegalStateException("uninitialized weights on " + name);
        }
    }

    public void setValues(float[] values){
        FloatUtil.checkSize(inputSize, values.length, "values of " + name);
        System.arraycopy(values, 0, this.values, 0, inputSize);
    }

    public void setBias(float[] bias){
        FloatUtil.checkSize(inputSize, bias.length, "bias of " + name);
        System.arraycopy(bias, 0, this.bias, 0, inputSize);
    }

    /** 出力層以外で使う。initWeightsで出力層の重みは消える */
    public void setWeight(float[][] weight){
        FloatUtil.checkSize(outputSize, weight.length, "weight rows of " + name);
        float[][] copied = new float[outputSize][];
        for(int i = 0; i < outputSize; ++i){
            FloatUtil.checkSize(inputSize, weight[i].length, "weight row of " + name);
            copied[i] = weight[i].clone();
        }
        this.weight = copied;
    }

    @JsonIgnore
    public DoubleSummaryStatistics getResultStatistics(){
        return FloatUtil.summary(values);
    }

    @JsonIgnore
    public DoubleSummaryStatistics getWeightStatistics(){
        return weight == null ? new DoubleSummaryStatistics() : FloatUtil.summary(weight);
    }

    @JsonIgnore
    public DoubleSummaryStatistics getBiasStatistics(){
        return FloatUtil.summary(bias);
    }

    @Override
    public String toString() {
        return String.format("%s:Fully connect %d->%d", name, inputSize, outputSize);
    }
}

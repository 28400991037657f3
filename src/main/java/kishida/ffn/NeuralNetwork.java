/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package kishida.ffn;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import kishida.ffn.layers.NeuralLayer;
import kishida.ffn.util.FloatUtil;
import lombok.Getter;

/**
 *
 * @author naoki
 */
public class NeuralNetwork {
    public static final float DEFAULT_LEARNING_RATE = 0.1f;
    public static final long DEFAULT_RANDOM_SEED = 1234;

    @Getter
    private final float learningRate;

    @Getter
    private final long randomSeed;

    @JsonIgnore
    @Getter
    private final Random random;

    private final List<NeuralLayer> layers = new ArrayList<>();

    public NeuralNetwork() {
        this(DEFAULT_LEARNING_RATE, DEFAULT_RANDOM_SEED);
    }

    public NeuralNetwork(float learningRate, long randomSeed) {
        this(learningRate, randomSeed, Collections.emptyList());
    }

    public NeuralNetwork(float learningRate, long randomSeed, List<NeuralLayer> layers) {
        this(Float.valueOf(learningRate), Long.valueOf(randomSeed), layers);
    }

    @JsonCreator
    NeuralNetwork(
            @JsonProperty("learningRate") Float learningRate,
            @JsonProperty("randomSeed") Long randomSeed,
            @JsonProperty("layers") List<NeuralLayer> layers) {
        this.learningRate = learningRate != null ? learningRate : DEFAULT_LEARNING_RATE;
        this.randomSeed = randomSeed != null ? randomSeed : DEFAULT_RANDOM_SEED;
        this.random = new Random(this.randomSeed);
        if(layers != null){
            layers.forEach(this::add);
        }
    }

    /** {@code [2, 4, 1]} -> 2->4, 4->1, 1->1 */
    public static NeuralNetwork of(float learningRate, long randomSeed, int... widths){
        if(widths.length == 0){
            throw new IllegalArgumentException("no widths");
        }
        NeuralNetwork nn = new NeuralNetwork(learningRate, randomSeed);
        for(int i = 0; i < widths.length; ++i){
            int out = i + 1 < widths.length ? widths[i + 1] : widths[i];
            String name = i == 0 ? "input"
                    : i == widths.length - 1 ? "output"
                    : "hidden" + i;
            nn.add(new NeuralLayer(name, widths[i], out));
        }
        return nn;
    }

    public void add(NeuralLayer layer){
        if(layers.stream().anyMatch(l -> l == layer)){
            throw new IllegalArgumentException(layer.getName() + " is already added");
        }
        if(!layers.isEmpty()){
            NeuralLayer tail = tail();
            FloatUtil.checkSize(tail.getOutputSize(), layer.getInputSize(),
                    "input of " + layer.getName() + " after " + tail.getName());
        }
        layers.add(layer);
    }

    public List<NeuralLayer> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    public void init(){
        for(int i = 0; i < layers.size(); ++i){
            NeuralLayer layer = layers.get(i);
            layer.initWeights(next(i), random);
            Logger.getLogger(NeuralNetwork.class.getName()).log(Level.FINE, "init {0}", layer);
        }
    }

    public void setInput(float[] input){
        head().setValues(input);
    }

    public void forward(){
        for(int i = 0; i < layers.size() - 1; ++i){
            layers.get(i).forward(layers.get(i + 1));
        }
    }

    public void backward(float[] labels){
        NeuralLayer tail = tail();
        float[] y = tail.getValues();
        FloatUtil.checkSize(tail.getInputSize(), labels.length, "labels");

        //誤差を求める
        float[] delta = new float[y.length];
        for(int i = 0; i < y.length; ++i){
            delta[i] = tail.getActivation().diff(y[i]) * (labels[i] - y[i]);
        }
        //逆伝播
        for(int i = layers.size() - 1; i >= 1; --i){
            delta = layers.get(i).backward(layers.get(i - 1), delta, learningRate);
        }
    }

    /** 1サンプルで1ステップ学習 */
    public void train(float[] input, float[] labels){
        setInput(input);
        forward();
        backward(labels);
    }

    /** 出力層の値のコピー */
    public float[] output(){
        return Arrays.copyOf(tail().getValues(), tail().getInputSize());
    }

    /** 二乗誤差 */
    public float cost(float[] labels){
        return FloatUtil.squaredError(labels, tail().getValues());
    }

    @JsonIgnore
    public boolean isEmpty(){
        return layers.isEmpty();
    }

    public NeuralLayer head(){
        checkNotEmpty();
        return layers.get(0);
    }

    public NeuralLayer tail(){
        checkNotEmpty();
        return layers.get(layers.size() - 1);
    }

    private NeuralLayer next(int index){
        return index + 1 < layers.size() ? layers.get(index + 1) : null;
    }

    private void checkNotEmpty(){
        if(layers.isEmpty()){
            throw new IllegalStateException("no layers");
        }
    }

    public Optional<NeuralLayer> findLayerByName(String name){
        return layers.stream()
                .filter(layer -> name.equals(layer.getName()))
                .findFirst();
    }

    public void writeAsJson(Writer writer) throws IOException{
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.writeValue(writer, this);
    }

    public static NeuralNetwork readFromJson(Reader reader) throws IOException{
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(reader, NeuralNetwork.class);
    }

}

/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package kishida.ffn;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import kishida.ffn.layers.NeuralLayer;
import lombok.Getter;

/**
 *
 * @author naoki
 */
public class NorGate {
    private static final String RESOURCE_NAME = "/nor_def.json";
    private static final String LOGGING_RESOURCE = "/logging.properties";
    private static final int TRAINING_SIZE = 100000;
    private static final int REPORT_INTERVAL = 10000;
    private static final int RESULT_COUNT = 20;

    private static final Logger LOGGER = Logger.getLogger(NorGate.class.getName());

    public static class Sample{
        @Getter
        final float[] input;
        @Getter
        final float[] label;

        Sample(int a, int b) {
            this.input = new float[]{a, b};
            this.label = new float[]{nor(a, b)};
        }
    }

    public static int nor(int a, int b){
        return ~(a | b) & 1;
    }

    static int randomBit(Random random){
        return (int)Math.round(random.nextDouble());
    }

    public static List<Sample> createSamples(Random random, int count){
        List<Sample> samples = new ArrayList<>(count);
        for(int i = 0; i < count; ++i){
            int a = randomBit(random);
            int b = randomBit(random);
            samples.add(new Sample(a, b));
        }
        return samples;
    }

    public static NeuralNetwork loadNetwork() throws IOException{
        try(InputStream is = NorGate.class.getResourceAsStream(RESOURCE_NAME)){
            if(is == null){
                throw new IOException(RESOURCE_NAME + " not found");
            }
            try(InputStreamReader isr = new InputStreamReader(is, StandardCharsets.UTF_8)){
                return NeuralNetwork.readFromJson(isr);
            }
        }
    }

    /** 最後の集計区間の平均誤差を返す */
    public static float train(NeuralNetwork nn, List<Sample> samples){
        float total = 0;
        int count = 0;
        for(int i = 0; i < samples.size(); ++i){
            Sample s = samples.get(i);
            nn.train(s.getInput(), s.getLabel());
            total += nn.cost(s.getLabel());
            ++count;
            if((i + 1) % REPORT_INTERVAL == 0){
                LOGGER.log(Level.INFO, "{0} steps, cost {1}", new Object[]{i + 1, total / count});
                if(i + 1 < samples.size()){
                    total = 0;
                    count = 0;
                }
            }
        }
        return count == 0 ? 0 : total / count;
    }

    public static float predict(NeuralNetwork nn, int a, int b){
        nn.setInput(new float[]{a, b});
        nn.forward();
        return nn.output()[0];
    }

    static void readLoggingConfig(){
        try(InputStream is = NorGate.class.getResourceAsStream(LOGGING_RESOURCE)){
            if(is != null){
                LogManager.getLogManager().readConfiguration(is);
            }
        }catch(IOException ex){
            LOGGER.log(Level.WARNING, "cannot read " + LOGGING_RESOURCE, ex);
        }
    }

    public static void main(String[] args) throws IOException {
        readLoggingConfig();
        NeuralNetwork nn = loadNetwork();
        nn.init();
        nn.getLayers().forEach(System.out::println);

        List<Sample> training = createSamples(nn.getRandom(), TRAINING_SIZE);
        System.out.println("Training...");
        train(nn, training);

        for(NeuralLayer layer : nn.getLayers()){
            System.out.printf("%s result: %.2f～%.2f average %.2f ", layer.getName(),
                    layer.getResultStatistics().getMin(),
                    layer.getResultStatistics().getMax(),
                    layer.getResultStatistics().getAverage());
            if(layer.getWeight() != null){
                System.out.printf("weight: %.2f～%.2f average %.2f ",
                        layer.getWeightStatistics().getMin(),
                        layer.getWeightStatistics().getMax(),
                        layer.getWeightStatistics().getAverage());
            }
            System.out.printf("bias: %.2f～%.2f average %.2f",
                    layer.getBiasStatistics().getMin(),
                    layer.getBiasStatistics().getMax(),
                    layer.getBiasStatistics().getAverage());
            System.out.println();
        }

        System.out.println("Results!");
        for(int i = 0; i < RESULT_COUNT; ++i){
            int a = randomBit(nn.getRandom());
            int b = randomBit(nn.getRandom());
            System.out.printf("%d NOR %d = %f%n", a, b, predict(nn, a, b));
        }

        System.out.println("Try it yourself!");
        Scanner scanner = new Scanner(System.in);
        if(!scanner.hasNextInt()){
            return;
        }
        int a = scanner.nextInt();
        if(!scanner.hasNextInt()){
            return;
        }
        int b = scanner.nextInt();
        System.out.printf("%d NOR %d = %f%n", a, b, predict(nn, a, b));
    }
}

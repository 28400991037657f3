package kishida.ffn.util;

import java.util.DoubleSummaryStatistics;
import java.util.Random;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/**
 *
 * @author naoki
 */
public class FloatUtil {

    private FloatUtil() {
    }

    public static DoubleSummaryStatistics summary(float[] data){
        return summary(data, 0, data.length);
    }
    public static DoubleSummaryStatistics summary(float[] data, int start, int end){
        return IntStream.range(start, end).mapToDouble(i -> data[i]).summaryStatistics();
    }

    public static DoubleSummaryStatistics summary(float[][] data){
        DoubleSummaryStatistics result = new DoubleSummaryStatistics();
        for(float[] row : data){
            toDoubleStream(row).forEach(result);
        }
        return result;
    }

    public static void checkSize(int expected, int actual, String what){
        if(expected != actual){
            throw new IllegalArgumentException(String.format(
                    "different sizes: %s expected %d but was %d", what, expected, actual));
        }
    }

    public static float dot(float[] a, float[] b){
        checkSize(a.length, b.length, "dot operand");
        float r = 0;
        for(int i = 0; i < a.length; ++i){
            r += a[i] * b[i];
        }
        return r;
    }

    /** 二乗誤差 */
    public static float squaredError(float[] a, float[] b){
        checkSize(a.length, b.length, "squared error operand");
        float r = 0;
        for(int i = 0; i < a.length; ++i){
            float d = a[i] - b[i];
            r += d * d;
        }
        return r;
    }

    public static float[] createUniformArray(int size, float min, float max, Random random){
        float[] result = new float[size];
        for(int i = 0; i < result.length; ++i){
            result[i] = (float)(min + (max - min) * random.nextDouble());
        }
        return result;
    }

    public static DoubleStream toDoubleStream(float[] data){
        return IntStream.range(0, data.length).mapToDouble(i -> data[i]);
    }
}

package kishida.ffn;

import java.io.IOException;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class NorGateTest {

    @Test
    public void testNor() {
        assertEquals(1, NorGate.nor(0, 0));
        assertEquals(0, NorGate.nor(0, 1));
        assertEquals(0, NorGate.nor(1, 0));
        assertEquals(0, NorGate.nor(1, 1));
    }

    @Test
    public void testCreateSamples() {
        List<NorGate.Sample> samples = NorGate.createSamples(new Random(1), 200);
        assertEquals(200, samples.size());
        boolean[] seen = new boolean[4];
        for (NorGate.Sample s : samples) {
            int a = (int) s.getInput()[0];
            int b = (int) s.getInput()[1];
            assertTrue(a == 0 || a == 1);
            assertTrue(b == 0 || b == 1);
            assertEquals(NorGate.nor(a, b), (int) s.getLabel()[0]);
            seen[a * 2 + b] = true;
        }
        for (boolean b : seen) {
            assertTrue(b);
        }
    }

    @Test
    public void testLoadNetwork() throws IOException {
        NeuralNetwork nn = NorGate.loadNetwork();
        assertEquals(0.1f, nn.getLearningRate());
        assertEquals(1234, nn.getRandomSeed());
        assertEquals(3, nn.getLayers().size());
        assertEquals(2, nn.head().getInputSize());
        assertEquals(1, nn.tail().getInputSize());
    }

    @Test
    public void testTrainOnRandomSamples() throws IOException {
        NeuralNetwork nn = NorGate.loadNetwork();
        nn.init();
        List<NorGate.Sample> samples = NorGate.createSamples(nn.getRandom(), 20000);

        float cost = NorGate.train(nn, samples);

        assertTrue(cost < 0.05f, "cost " + cost);
        assertTrue(NorGate.predict(nn, 0, 0) > 0.5f);
        assertTrue(NorGate.predict(nn, 0, 1) < 0.5f);
        assertTrue(NorGate.predict(nn, 1, 0) < 0.5f);
        assertTrue(NorGate.predict(nn, 1, 1) < 0.5f);
    }
}

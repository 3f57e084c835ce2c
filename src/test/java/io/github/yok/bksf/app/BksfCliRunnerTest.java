package io.github.yok.bksf.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.bksf.core.convert.DoubleExcitationSign;
import io.github.yok.bksf.core.mapper.BravyiKitaevSuperFastMapper;
import io.github.yok.bksf.in.CsvFermionicOperatorReader;
import io.github.yok.bksf.out.CsvResultWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class BksfCliRunnerTest {

    @TempDir
    Path dir;

    private BksfCliRunner runner(DoubleExcitationSign sign) {
        BksfProperties p = new BksfProperties();
        p.getInput().setFile("src/test/resources/h2_sto3g.csv");
        p.getMapping().setDoubleExcitationSign(sign);
        p.getOutput().setDir(dir.toString());
        return new BksfCliRunner(p, new CsvFermionicOperatorReader(p.getInput().getFile()),
                new BravyiKitaevSuperFastMapper(sign, p.getMapping().getSimplifyTolerance()),
                new CsvResultWriter(p.getOutput().getDir()));
    }

    @Test
    void mapsHydrogenFixtureToCsv() throws IOException {
        runner(DoubleExcitationSign.NEGATIVE).run();

        List<String> pauli =
                Files.readAllLines(dir.resolve("bksf_pauli_h2_sto3g.csv"), StandardCharsets.UTF_8);
        List<String> meta =
                Files.readAllLines(dir.resolve("bksf_meta_h2_sto3g.csv"), StandardCharsets.UTF_8);

        assertEquals(17, pauli.size());
        assertTrue(pauli.get(1).startsWith("IIII,-0.81261796"), pauli.get(1));
        assertTrue(meta.contains("qubits,4"), meta.toString());
        assertTrue(meta.contains("edge.3,1-3"), meta.toString());
    }

    @Test
    void positiveSignWritesFourteenTerms() throws IOException {
        runner(DoubleExcitationSign.POSITIVE).run();

        List<String> pauli =
                Files.readAllLines(dir.resolve("bksf_pauli_h2_sto3g.csv"), StandardCharsets.UTF_8);
        List<String> meta =
                Files.readAllLines(dir.resolve("bksf_meta_h2_sto3g.csv"), StandardCharsets.UTF_8);

        assertEquals(15, pauli.size());
        assertTrue(meta.contains("doubleExcitationSign,POSITIVE"), meta.toString());
    }

    @Test
    void propertiesPrintAsYamlLikeBlock() {
        BksfProperties p = new BksfProperties();
        p.getInput().setFile("in.csv");

        String text = p.toMultilineString();

        assertTrue(text.contains("  mapping:"), text);
        assertTrue(text.contains("    doubleExcitationSign: NEGATIVE"), text);
        assertTrue(text.contains("    dir: ./out"), text);
    }
}

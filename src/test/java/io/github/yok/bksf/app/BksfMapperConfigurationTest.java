package io.github.yok.bksf.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.bksf.core.convert.DoubleExcitationSign;
import io.github.yok.bksf.core.mapper.BravyiKitaevSuperFastMapper;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"bksf.input.file=src/test/resources/h2_sto3g.csv",
        "bksf.output.dir=target/bksf-context-test", "bksf.mapping.double-excitation-sign=POSITIVE",
        "bksf.mapping.simplify-tolerance=1e-10"})
final class BksfMapperConfigurationTest {

    @Autowired
    private BksfProperties properties;

    @Autowired
    private BravyiKitaevSuperFastMapper mapper;

    @Test
    void bindsPropertiesIntoMapperAndRunsOnStartup() {
        assertEquals(DoubleExcitationSign.POSITIVE,
                properties.getMapping().getDoubleExcitationSign());
        assertEquals(DoubleExcitationSign.POSITIVE, mapper.getDoubleExcitationSign());
        assertEquals(1e-10, mapper.getSimplifyTolerance(), 0.0);
        assertTrue(Files.exists(Paths.get("target/bksf-context-test/bksf_pauli_h2_sto3g.csv")));
    }
}

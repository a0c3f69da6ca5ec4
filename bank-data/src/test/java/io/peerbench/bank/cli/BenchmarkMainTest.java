package io.peerbench.bank.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkMainTest {

    @Test
    void compositeRangeSubjectIsAConfigurationError() {
        int code = new CommandLine(new BenchmarkMain()).execute("--subject", "90001", "--no-heal");
        assertEquals(BenchmarkMain.EXIT_BAD_CONFIG, code);
    }

    @Test
    void nonPositiveQuartersIsAConfigurationError() {
        int code = new CommandLine(new BenchmarkMain()).execute("-q", "0");
        assertEquals(BenchmarkMain.EXIT_BAD_CONFIG, code);
    }

    @Test
    void malformedGroupIsAConfigurationError() {
        int code = new CommandLine(new BenchmarkMain()).execute("-g", "CORE-only", "--no-heal");
        assertEquals(BenchmarkMain.EXIT_BAD_CONFIG, code);
    }

    @Test
    void parsesOptions() {
        BenchmarkMain main = new BenchmarkMain();
        new CommandLine(main).parseArgs("-s", "628", "-g", "A:First:1,2", "-g", "B:Second:3", "--no-heal");
        assertEquals(628, main.subject);
        assertEquals(2, main.groups.size());
        assertTrue(main.noHeal);
    }
}

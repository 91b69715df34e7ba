package org.powerdiagram.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.powerdiagram.DiagramSettings;
import org.powerdiagram.PowerDiagram;
import org.powerdiagram.layout.CapturedValue;
import org.powerdiagram.layout.OperatorKind;
import org.powerdiagram.message.DiagramMessage;
import org.powerdiagram.source.SourceSpan;
import org.powerdiagram.source.TextSourceMap;

/**
 * Cost of laying out a three-line assertion with six captured values, with and without the final
 * string rendering.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@State(Scope.Benchmark)
public class DiagramRenderBenchmark {

    private static final String SOURCE = String.join("\n",
            "class FactionRules {",
            "    void check() {",
            "        assert faction.influence > 50",
            "            && faction.stability >= threshold",
            "            && !faction.atWar;",
            "    }",
            "}");

    private PowerDiagram diagram;
    private SourceSpan callSpan;
    private List<CapturedValue<Object>> captured;

    @Setup(Level.Trial)
    public void init() {
        TextSourceMap sourceMap = new TextSourceMap(SOURCE);
        diagram = new PowerDiagram(sourceMap, DiagramSettings.defaults());

        int start = SOURCE.indexOf("faction.influence");
        int end = SOURCE.indexOf(';');
        callSpan = SourceSpan.of(start, end);

        captured = List.of(
                capture("faction.influence", 42, OperatorKind.NONE),
                capture("faction.influence > 50", false, OperatorKind.GT),
                capture("faction.stability", 7, OperatorKind.NONE),
                capture("threshold", 5, OperatorKind.NONE),
                capture("faction.stability >= threshold", true, OperatorKind.GT_EQ),
                capture("faction.atWar", true, OperatorKind.NONE));
    }

    private static CapturedValue<Object> capture(String text, Object value, OperatorKind operator) {
        int start = SOURCE.indexOf(text);
        return CapturedValue.of(SourceSpan.of(start, start + text.length()), value, operator);
    }

    @Benchmark
    public DiagramMessage<Object> layout() {
        return diagram.build("Assertion failed", callSpan, captured);
    }

    @Benchmark
    public String layoutAndRender() {
        return diagram.build("Assertion failed", callSpan, captured).render();
    }
}

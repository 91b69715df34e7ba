package org.powerdiagram;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.powerdiagram.layout.CapturedValue;
import org.powerdiagram.layout.OperatorKind;
import org.powerdiagram.message.DiagramMessage;
import org.powerdiagram.message.Segment;
import org.powerdiagram.source.SourceSpan;
import org.powerdiagram.source.TextSourceMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PowerDiagramTest {

    // c h e c k ( a   = = b )
    // 0 1 2 3 4 5 6 7 8 9 0 1 2
    private static final String COMPARISON = "check(a == b)";

    // "class T {\n" is 10 characters; the call starts at column 4 of line 1 (offset 14)
    private static final String MULTI_LINE = "class T {\n    check(a &&\n          b)\n}";

    // ── single line ─────────────────────────────────────────────────────

    @Test
    void singleValue() {
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap("check(x)"), DiagramSettings.defaults());

        String rendered = diagram.render("Assertion failed", SourceSpan.of(0, 8),
                                         List.of(CapturedValue.of(SourceSpan.of(6, 7), 1)));

        assertThat(rendered).isEqualTo("Assertion failed\ncheck(x)\n      |\n      1");
    }

    @Test
    void comparison_anchorsUnderOperator() {
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap(COMPARISON), DiagramSettings.defaults());

        String rendered = diagram.render("Assertion failed", SourceSpan.of(0, 13), comparisonValues());

        assertThat(rendered).isEqualTo(String.join("\n",
            "Assertion failed",
            "check(a == b)",
            "      | |  |",
            "      | |  2",
            "      | false",
            "      1"));
    }

    @Test
    void everyValueSitsUnderItsMarker() {
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap(COMPARISON), DiagramSettings.defaults());

        String[] lines = diagram.build("T", SourceSpan.of(0, 13), comparisonValues())
            .render(value -> "@")
            .split("\n");

        String barLine = lines[2];
        for (int i = 3; i < lines.length; i++) {
            int column = lines[i].indexOf('@');
            assertThat(column).isEqualTo(lines[i].length() - 1);
            assertThat(barLine.charAt(column)).isEqualTo('|');
        }
    }

    @Test
    void sameSpanCapturedTwice_keepsCaptureOrder() {
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap("check(x)"), DiagramSettings.defaults());

        DiagramMessage<String> message = diagram.build("T", SourceSpan.of(0, 8), List.of(
            CapturedValue.of(SourceSpan.of(6, 7), "first"),
            CapturedValue.of(SourceSpan.of(6, 7), "second")));

        assertThat(message.values()).containsExactly("first", "second");
        assertThat(message.render()).isEqualTo("T\ncheck(x)\n      |\n      first\n      second");
    }

    // ── multi line ──────────────────────────────────────────────────────

    @Test
    void multiLine_stripsCallIndentAndPlacesValuesPerRow() {
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap(MULTI_LINE), DiagramSettings.defaults());

        String rendered = diagram.render("Assertion failed", SourceSpan.of(14, 37), List.of(
            CapturedValue.of(SourceSpan.of(20, 21), true),
            CapturedValue.of(SourceSpan.of(35, 36), false)));

        assertThat(rendered).isEqualTo(String.join("\n",
            "Assertion failed",
            "check(a &&",
            "      |",
            "      true",
            "      b)",
            "      |",
            "      false"));
    }

    @Test
    void multiLine_operatorOnFollowingLine() {
        // the comparison starts on the first line but its operator sits on the second
        String text = "check(a\n      == b)";
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap(text), DiagramSettings.defaults());

        String rendered = diagram.render("T", SourceSpan.of(0, text.length()), List.<CapturedValue<Object>>of(
            CapturedValue.of(SourceSpan.of(6, 7), 1),
            CapturedValue.of(SourceSpan.of(17, 18), 2),
            CapturedValue.of(SourceSpan.of(6, 18), false, OperatorKind.EQ)));

        assertThat(rendered).isEqualTo(String.join("\n",
            "T",
            "check(a",
            "      |",
            "      1",
            "      == b)",
            "      |  |",
            "      |  2",
            "      false"));
    }

    @Test
    void noCapturedValues_titleAndSourceOnly() {
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap(MULTI_LINE), DiagramSettings.defaults());

        DiagramMessage<Object> message = diagram.build("Assertion failed", SourceSpan.of(14, 37), List.of());

        assertThat(message.segments()).containsExactly(Segment.literal("Assertion failed\ncheck(a &&\n      b)"));
    }

    // ── contract ────────────────────────────────────────────────────────

    @Test
    void repeatedBuilds_areIdentical() {
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap(COMPARISON), DiagramSettings.defaults());

        DiagramMessage<Object> first = diagram.build("T", SourceSpan.of(0, 13), comparisonValues());
        DiagramMessage<Object> second = diagram.build("T", SourceSpan.of(0, 13), comparisonValues());

        assertThat(first).isEqualTo(second);
        assertThat(first.render()).isEqualTo(second.render());
    }

    @Test
    void missingOperatorToken_degradesToStartColumn() {
        String text = "check(a.equals(b))";
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap(text), DiagramSettings.defaults());

        String rendered = diagram.render("T", SourceSpan.of(0, text.length()),
                                         List.of(CapturedValue.of(SourceSpan.of(6, 17), false, OperatorKind.EQ)));

        assertThat(rendered).isEqualTo("T\ncheck(a.equals(b))\n      |\n      false");
    }

    @Test
    void missingOperatorToken_strictModeFails() {
        String text = "check(a.equals(b))";
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap(text),
                                                DiagramSettings.defaults().withStrictAnchors(true));

        assertThatThrownBy(() -> diagram.build("T", SourceSpan.of(0, text.length()),
                                               List.of(CapturedValue.of(SourceSpan.of(6, 17), false, OperatorKind.EQ))))
            .isInstanceOf(AnchorNotFoundException.class);
    }

    @Test
    void capturedSpanOutsideText_fails() {
        PowerDiagram diagram = new PowerDiagram(new TextSourceMap("check(x)"), DiagramSettings.defaults());

        assertThatThrownBy(() -> diagram.build("T", SourceSpan.of(0, 8), List.of(CapturedValue.of(SourceSpan.of(6, 20), 1))))
            .isInstanceOf(InvalidSpanException.class);
        assertThatThrownBy(() -> diagram.build("T", SourceSpan.of(0, 9), List.of()))
            .isInstanceOf(InvalidSpanException.class);
    }

    private static List<CapturedValue<Object>> comparisonValues() {
        return List.of(
            CapturedValue.of(SourceSpan.of(6, 7), 1),
            CapturedValue.of(SourceSpan.of(11, 12), 2),
            CapturedValue.of(SourceSpan.of(6, 12), false, OperatorKind.EQ));
    }
}

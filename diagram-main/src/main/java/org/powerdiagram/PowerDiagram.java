package org.powerdiagram;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import org.powerdiagram.layout.CapturedValue;
import org.powerdiagram.layout.DiagramAssembler;
import org.powerdiagram.layout.IndentationNormalizer;
import org.powerdiagram.layout.OperatorAnchorResolver;
import org.powerdiagram.layout.RowIndentProjector;
import org.powerdiagram.layout.ValueDisplay;
import org.powerdiagram.message.DiagramMessage;
import org.powerdiagram.source.SourceMap;
import org.powerdiagram.source.SourceSpan;
import org.powerdiagram.source.SpanInfo;

/**
 * Builds assertion diagrams: the source of a call reprinted under a title, with the values of its
 * captured subexpressions aligned beneath the columns that produced them.
 * <p>
 * Instances hold no per-call state and may be shared between threads.
 */
public final class PowerDiagram {

    private static final Logger LOG = Logger.getLogger(PowerDiagram.class.getName());

    private final SourceMap sourceMap;
    private final OperatorAnchorResolver anchorResolver;

    public PowerDiagram(SourceMap sourceMap) {
        this(sourceMap, DiagramSettings.fromSystemProperties());
    }

    public PowerDiagram(SourceMap sourceMap, DiagramSettings settings) {
        this.sourceMap = Objects.requireNonNull(sourceMap, "sourceMap");
        this.anchorResolver = new OperatorAnchorResolver(Objects.requireNonNull(settings, "settings"));
    }

    /**
     * Lays out the diagram for one call.
     *
     * @param title    first line of the message, e.g. {@code "Assertion failed"}
     * @param callSpan span of the whole call
     * @param captured subexpressions to display, in capture order
     * @return the message; its slots reference the captured values in display order
     * @throws InvalidSpanException    if any span lies outside the source
     * @throws AnchorNotFoundException if strict anchoring is enabled and an operator token is missing
     */
    public <V> DiagramMessage<V> build(String title, SourceSpan callSpan, List<CapturedValue<V>> captured) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(captured, "captured");

        SpanInfo callInfo = sourceMap.resolve(callSpan);
        int callIndent = callInfo.startColumn();
        String callSource = IndentationNormalizer.normalize(sourceMap.slice(callSpan), callIndent);

        List<ValueDisplay<V>> displays = new ArrayList<>(captured.size());
        for (CapturedValue<V> value : captured) {
            String source = IndentationNormalizer.normalize(sourceMap.slice(value.span()), callIndent);
            int anchor = anchorResolver.anchorOffset(source, value.operator());
            ValueDisplay<V> display = RowIndentProjector.project(callInfo, sourceMap.resolve(value.span()),
                                                                 source, anchor, value.value());
            LOG.finer(() -> "'" + display.source() + "' -> row " + display.row() + ", indent " + display.indent());
            displays.add(display);
        }

        return DiagramAssembler.assemble(title, callSource, displays);
    }

    /**
     * Builds the diagram and renders it with {@link String#valueOf(Object)}.
     */
    public <V> String render(String title, SourceSpan callSpan, List<CapturedValue<V>> captured) {
        return build(title, callSpan, captured).render();
    }
}

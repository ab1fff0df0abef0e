import org.junit.jupiter.api.Test;

import com.elara.pine.metadata.BackgroundDescriptor;
import com.elara.pine.metadata.IndicatorMetadata;
import com.elara.pine.metadata.InputDescriptor;
import com.elara.pine.metadata.InputType;
import com.elara.pine.metadata.MetadataVisitor;
import com.elara.pine.metadata.PlotDescriptor;
import com.elara.pine.metadata.PlotType;
import com.elara.pine.metadata.Warning;
import com.elara.pine.metadata.WarningCollector;
import com.elara.pine.parser.Lexer;
import com.elara.pine.parser.ParseResult;
import com.elara.pine.parser.Parser;
import com.elara.pine.parser.Program;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PineMetadataTest {

    private static Program program(String src) {
        Lexer lexer = new Lexer(src);
        Parser parser = new Parser(lexer.tokenize());
        parser.setVersion(lexer.version());
        ParseResult result = parser.parse();
        assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());
        return result.program();
    }

    private static IndicatorMetadata metadata(String src) {
        return new MetadataVisitor().visit(program(src));
    }

    private static final String RSI =
            "//@version=5\n" +
            "indicator(\"My RSI\", shorttitle=\"RSI\", overlay=true)\n" +
            "len = input.int(14, \"Length\", minval=1, maxval=100)\n" +
            "src = input(close, \"Source\")\n" +
            "fast = input(2.5, \"Fast\")\n" +
            "r = ta.rsi(src, len)\n" +
            "plot(r, \"RSI\", color=color.red, linewidth=2)\n" +
            "hline(70, \"Upper\")\n" +
            "plotshape(r > 70, \"Signal\", style=shape.triangledown)\n";

    @Test
    public void readsIndicatorHeader() {
        IndicatorMetadata md = metadata(RSI);
        assertEquals("My RSI", md.name());
        assertEquals("RSI", md.shortName());
        assertTrue(md.overlay());
        assertEquals(5, md.version());
    }

    @Test
    public void headerDefaultsWithoutDeclaration() {
        IndicatorMetadata md = metadata("x = 1\n");
        assertEquals(IndicatorMetadata.DEFAULT_NAME, md.name());
        assertEquals(IndicatorMetadata.DEFAULT_SHORT_NAME, md.shortName());
        assertFalse(md.overlay());
    }

    @Test
    public void shortTitleFallsBackToTitle() {
        IndicatorMetadata md = metadata("indicator(\"Only Title\")\n");
        assertEquals("Only Title", md.shortName());
    }

    @Test
    public void extractsInputsInSourceOrder() {
        List<InputDescriptor> inputs = metadata(RSI).inputs();
        assertEquals(3, inputs.size());

        InputDescriptor len = inputs.get(0);
        assertEquals("in_0", len.id);
        assertEquals("Length", len.title);
        assertEquals(InputType.INTEGER, len.type);
        assertEquals(14.0, len.defval);
        assertEquals(1.0, len.min);
        assertEquals(100.0, len.max);

        InputDescriptor src = inputs.get(1);
        assertEquals(InputType.SOURCE, src.type);
        assertEquals("close", src.defval);

        InputDescriptor fast = inputs.get(2);
        assertEquals("in_2", fast.id);
        assertEquals(InputType.FLOAT, fast.type);
    }

    @Test
    public void inputTitleAndTypeDefaults() {
        List<InputDescriptor> inputs = metadata(
                "a = input(10)\n" +
                "b = input.bool(true)\n" +
                "c = input.string(\"x\", options=[\"x\", \"y\"])\n" +
                "d = input.source()\n").inputs();
        assertEquals("Input 1", inputs.get(0).title);
        assertEquals(InputType.INTEGER, inputs.get(0).type);
        assertEquals(InputType.BOOL, inputs.get(1).type);
        assertEquals(List.of("x", "y"), inputs.get(2).options);
        assertEquals("close", inputs.get(3).defval);
    }

    @Test
    public void extractsPlots() {
        List<PlotDescriptor> plots = metadata(RSI).plots();
        assertEquals(3, plots.size());

        PlotDescriptor line = plots.get(0);
        assertEquals("plot_0", line.id);
        assertEquals("RSI", line.title);
        assertEquals(PlotType.LINE, line.type);
        assertEquals("#FF5252", line.color);
        assertEquals(2, line.linewidth);

        PlotDescriptor upper = plots.get(1);
        assertEquals(PlotType.HLINE, upper.type);
        assertEquals(70.0, upper.price);
        assertEquals("#787B86", upper.color);

        PlotDescriptor signal = plots.get(2);
        assertEquals(PlotType.SHAPE, signal.type);
        assertEquals("triangledown", signal.shape);
        assertEquals("abovebar", signal.location);
    }

    @Test
    public void plotDefaultsAndStyles() {
        List<PlotDescriptor> plots = metadata(
                "plot(close)\n" +
                "plot(volume, \"Vol\", #00FF00, 1, plot.style_columns)\n" +
                "hline(price=na)\n").plots();
        assertEquals(2, plots.size());
        assertEquals("Plot 1", plots.get(0).title);
        assertEquals("#2962FF", plots.get(0).color);
        assertEquals(PlotType.HISTOGRAM, plots.get(1).type);
        assertEquals("#00FF00", plots.get(1).color);
    }

    @Test
    public void backgroundColorsResolveThroughColorNew() {
        List<BackgroundDescriptor> bgs = metadata(
                "bgcolor(color.new(color.green, 90))\n" +
                "bgcolor(up ? color.red : color.blue)\n").backgrounds();
        assertEquals(2, bgs.size());
        assertEquals("#4CAF50", bgs.get(0).color);
        assertEquals(90, bgs.get(0).transparency);
        assertFalse(bgs.get(0).conditional);
        assertTrue(bgs.get(1).conditional);
    }

    @Test
    public void tracksSourcesAndHistoricalAccess() {
        IndicatorMetadata md = metadata(
                "x = close * 2\n" +
                "y = x[1] + high[3]\n");
        assertEquals(List.of("x", "high"), List.copyOf(md.historicalAccess()));
        assertTrue(md.usedSources().contains("close"));
        assertTrue(md.usedSources().contains("high"));
        assertFalse(md.usedSources().contains("low"));
    }

    @Test
    public void warnsOncePerFunction() {
        IndicatorMetadata md = metadata(
                "alert(\"a\")\n" +
                "alert(\"b\")\n" +
                "study(\"old\")\n" +
                "fill(p1, p2)\n");
        List<Warning> warnings = md.warnings();
        assertEquals(3, warnings.size());

        Warning alert = warnings.get(0);
        assertEquals(Warning.Severity.UNSUPPORTED, alert.severity);
        assertEquals("alert", alert.feature);
        assertEquals("Function 'alert' is not supported and will be ignored at runtime", alert.message);
        assertEquals(Warning.Severity.DEPRECATED, warnings.get(1).severity);
        assertEquals(Warning.Severity.PARTIAL, warnings.get(2).severity);
    }

    @Test
    public void ownedCollectorResetsBetweenVisits() {
        MetadataVisitor visitor = new MetadataVisitor();
        Program p = program("alert(\"a\")\n");
        assertEquals(1, visitor.visit(p).warnings().size());
        assertEquals(1, visitor.visit(p).warnings().size());
    }

    @Test
    public void sharedCollectorDeduplicatesAcrossRunsUntilReset() {
        WarningCollector collector = new WarningCollector();
        Program p = program("request.security(\"X\", \"D\", close)\n");

        assertEquals(1, new MetadataVisitor(collector).visit(p).warnings().size());
        assertEquals(1, new MetadataVisitor(collector).visit(p).warnings().size());
        assertEquals(1, collector.warnings().size());

        collector.reset();
        assertTrue(collector.warnings().isEmpty());
    }

    @Test
    public void serializesToJson() {
        JsonNode json = metadata(RSI).toJson(new ObjectMapper());
        assertEquals("My RSI", json.get("name").asText());
        assertEquals("in_0", json.get("inputs").get(0).get("id").asText());
        assertEquals("integer", json.get("inputs").get(0).get("type").asText());
        assertEquals("plot_0", json.get("plots").get(0).get("id").asText());
        assertEquals("partial", json.get("warnings").get(0).get("severity").asText());
    }

    @Test
    public void timeInputWithoutDefaultIsStable() {
        InputDescriptor first = metadata("t = input.time()\n").inputs().get(0);
        InputDescriptor second = metadata("t = input.time()\n").inputs().get(0);
        assertEquals(InputType.INTEGER, first.type);
        assertEquals(0.0, first.defval);
        assertEquals(first.defval, second.defval);
    }
}

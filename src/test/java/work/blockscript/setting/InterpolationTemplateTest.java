package work.blockscript.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class InterpolationTemplateTest {
    @Test
    void splitsTextAndPlaceholders() {
        var parts = InterpolationTemplate.parse("https://<host>/api?q=<globals.query>");
        assertEquals(List.of(
            new InterpolationTemplate.Part(false, "https://"),
            new InterpolationTemplate.Part(true, "host"),
            new InterpolationTemplate.Part(false, "/api?q="),
            new InterpolationTemplate.Part(true, "globals.query")), parts);
    }

    @Test
    void bracketsWithoutIdentifierStayLiteral() {
        assertEquals(List.of(new InterpolationTemplate.Part(false, "< b > x <1>")), InterpolationTemplate.parse("< b > x <1>"));
        assertEquals(List.of("b"), InterpolationTemplate.variables("<b>"));
    }
}

package ai.romantext.harmony.writer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A complete RomanText document: metadata preamble followed by the measure body.
 */
public record RomanTextDocument(Preamble preamble, List<DocumentLine> body) {

    public RomanTextDocument {
        Objects.requireNonNull(preamble, "preamble");
        body = List.copyOf(Objects.requireNonNull(body, "body"));
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>(preamble.lines());
        lines.addAll(LineSerializer.render(body));
        return lines;
    }
}

package ai.romantext.harmony.writer;

import ai.romantext.harmony.repeat.RepeatRange;
import java.util.Objects;

/**
 * One line of a RomanText document body.
 */
public sealed interface DocumentLine {

    String render();

    record TimeSignatureDirective(String ratio) implements DocumentLine {

        public TimeSignatureDirective {
            Objects.requireNonNull(ratio, "ratio");
        }

        @Override
        public String render() {
            return "\nTime Signature: " + ratio;
        }
    }

    record RepeatShorthand(RepeatRange range) implements DocumentLine {

        public RepeatShorthand {
            Objects.requireNonNull(range, "range");
        }

        @Override
        public String render() {
            if (range.isSingleMeasure()) {
                return "m" + range.targetStart() + " = m" + range.sourceStart();
            }
            return "m" + range.targetStart() + "-" + range.targetEnd()
                    + " = m" + range.sourceStart() + "-" + range.sourceEnd();
        }
    }

    record MeasureContent(int measure, String text) implements DocumentLine {

        public MeasureContent {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String render() {
            return text;
        }
    }

    record EmptyMeasureTemplate(int measure) implements DocumentLine {

        @Override
        public String render() {
            return "m" + measure + " b1";
        }
    }
}

package ai.romantext.harmony.cli;

import ai.romantext.harmony.annotation.AnnotationTextClass;
import picocli.CommandLine;

public class AnnotationTextClassConverter implements CommandLine.ITypeConverter<AnnotationTextClass> {
    @Override
    public AnnotationTextClass convert(String value) {
        return AnnotationTextClass.from(value);
    }
}

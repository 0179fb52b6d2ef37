package ai.docsite.reviewer.cli;

import ai.docsite.reviewer.config.LogFormat;
import ai.docsite.reviewer.config.SortOrder;
import java.util.function.Function;
import picocli.CommandLine;

/**
 * picocli converters for enum-valued options; parse errors surface as invalid input.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return parse(value, LogFormat::from);
        }
    }

    public static final class SortOrderConverter implements CommandLine.ITypeConverter<SortOrder> {
        @Override
        public SortOrder convert(String value) {
            return parse(value, SortOrder::from);
        }
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}

package vn.legaldoc.structure.cli;

import picocli.CommandLine;
import vn.legaldoc.structure.config.LogFormat;

/**
 * Parses the {@code --log-format} option.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        return LogFormat.from(value);
    }
}
